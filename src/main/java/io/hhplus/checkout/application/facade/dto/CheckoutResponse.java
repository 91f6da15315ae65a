package io.hhplus.checkout.application.facade.dto;

import io.hhplus.checkout.application.order.dto.OrderResponse;
import io.hhplus.checkout.application.payment.dto.PaymentIntentResponse;

/**
 * 체크아웃 결과
 *
 * @param order         생성된 주문
 * @param paymentIntent 카드 결제 수단일 때 생성된 결제 요청 (그 외 null)
 * @param paymentError  결제 요청 생성 실패 시 에러 정보 (성공 또는 비카드 결제 시 null)
 */
public record CheckoutResponse(
    OrderResponse order,
    PaymentIntentResponse paymentIntent,
    PaymentErrorResponse paymentError
) {
    public static CheckoutResponse orderOnly(OrderResponse order) {
        return new CheckoutResponse(order, null, null);
    }

    public static CheckoutResponse withIntent(OrderResponse order, PaymentIntentResponse paymentIntent) {
        return new CheckoutResponse(order, paymentIntent, null);
    }

    public static CheckoutResponse withPaymentError(OrderResponse order, PaymentErrorResponse paymentError) {
        return new CheckoutResponse(order, null, paymentError);
    }

    public boolean paymentFailed() {
        return paymentError != null;
    }
}
