package io.hhplus.checkout.application.payment.dto;

import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.PaymentIntent;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;

import java.math.BigDecimal;

public record PaymentIntentResponse(
    Long paymentIntentId,
    Long orderId,
    String gatewayIntentId,
    String clientSecret,
    BigDecimal amount,
    Currency currency,
    PaymentIntentStatus status,
    BigDecimal capturedAmount,
    BigDecimal refundedAmount,
    String failureReason
) {
    public static PaymentIntentResponse from(PaymentIntent intent) {
        return new PaymentIntentResponse(
            intent.getId(),
            intent.getOrderId(),
            intent.getGatewayIntentId(),
            intent.getClientSecret(),
            intent.getAmount(),
            intent.getCurrency(),
            intent.getStatus(),
            intent.getCapturedAmount(),
            intent.getRefundedAmount(),
            intent.getFailureReason()
        );
    }
}
