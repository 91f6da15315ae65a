package io.hhplus.checkout.application.order.dto;

import io.hhplus.checkout.domain.order.Address;
import io.hhplus.checkout.domain.order.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 주문 생성 요청 (체크아웃)
 *
 * 주문 상품은 요청이 아니라 사용자의 장바구니에서 읽는다.
 * billingAddress가 없으면 배송지를 청구지로 사용한다.
 */
public record CreateOrderRequest(
    @NotNull(message = "배송지는 필수입니다")
    @Valid
    AddressRequest shippingAddress,

    @Valid
    AddressRequest billingAddress,

    @NotNull(message = "결제 수단은 필수입니다")
    PaymentMethod paymentMethod,

    @Size(max = 500, message = "요청사항은 500자 이하여야 합니다")
    String notes
) {
    public Address billingAddressOrNull() {
        return billingAddress != null ? billingAddress.toAddress() : null;
    }
}
