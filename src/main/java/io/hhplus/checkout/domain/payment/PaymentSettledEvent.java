package io.hhplus.checkout.domain.payment;

import io.hhplus.checkout.domain.order.PaymentStatus;

import java.math.BigDecimal;

/**
 * 결제 상태 확정 이벤트 (PAID, FAILED, REFUNDED)
 *
 * source: confirm(동기 승인), webhook(비동기 통지), refund
 */
public record PaymentSettledEvent(
    Long orderId,
    String orderNumber,
    Long userId,
    PaymentStatus paymentStatus,
    BigDecimal amount,
    String source
) {}
