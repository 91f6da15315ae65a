package io.hhplus.checkout.application.payment.dto;

import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.PaymentStatus;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;

import java.math.BigDecimal;

/**
 * 주문 결제 상태
 *
 * gatewayStatus는 대행사 실시간 조회 결과다. 조회에 실패하면 null.
 */
public record PaymentStatusResponse(
    Long orderId,
    String orderNumber,
    OrderStatus orderStatus,
    PaymentStatus paymentStatus,
    BigDecimal totalAmount,
    Long paymentIntentId,
    String gatewayIntentId,
    PaymentIntentStatus intentStatus,
    PaymentIntentStatus gatewayStatus
) {}
