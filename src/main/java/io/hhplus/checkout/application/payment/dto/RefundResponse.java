package io.hhplus.checkout.application.payment.dto;

import io.hhplus.checkout.domain.order.PaymentStatus;
import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.Refund;
import io.hhplus.checkout.domain.payment.RefundReason;

import java.math.BigDecimal;

public record RefundResponse(
    Long refundId,
    Long orderId,
    Long paymentIntentId,
    String gatewayRefundId,
    BigDecimal amount,
    Currency currency,
    RefundReason reason,
    boolean fullRefund,
    PaymentStatus paymentStatus,
    BigDecimal remainingRefundableAmount
) {
    public static RefundResponse of(Refund refund, PaymentStatus paymentStatus, BigDecimal remainingRefundableAmount) {
        return new RefundResponse(
            refund.getId(),
            refund.getOrderId(),
            refund.getPaymentIntentId(),
            refund.getGatewayRefundId(),
            refund.getAmount(),
            refund.getCurrency(),
            refund.getReason(),
            refund.isFullRefund(),
            paymentStatus,
            remainingRefundableAmount
        );
    }
}
