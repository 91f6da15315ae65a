package io.hhplus.checkout.domain.payment;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;

import java.util.Optional;

public interface PaymentIntentRepository {

    Optional<PaymentIntent> findById(Long id);

    Optional<PaymentIntent> findByOrderId(Long orderId);

    Optional<PaymentIntent> findByGatewayIntentId(String gatewayIntentId);

    PaymentIntent save(PaymentIntent paymentIntent);

    default PaymentIntent findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PAYMENT_INTENT_NOT_FOUND,
                "결제 요청을 찾을 수 없습니다. paymentIntentId: " + id
            ));
    }
}
