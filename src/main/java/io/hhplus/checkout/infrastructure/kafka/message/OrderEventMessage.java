package io.hhplus.checkout.infrastructure.kafka.message;

import io.hhplus.checkout.domain.order.OrderCreatedEvent;
import io.hhplus.checkout.domain.order.OrderStatusChangedEvent;
import io.hhplus.checkout.domain.payment.PaymentSettledEvent;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Kafka 주문 이벤트 메시지
 * - Topic: order-events
 * - Key: orderId (같은 주문의 이벤트는 같은 파티션으로 전달되어 순서가 유지된다)
 */
public record OrderEventMessage(
    String eventType,
    Long orderId,
    String orderNumber,
    Long userId,
    String status,
    BigDecimal amount,
    LocalDateTime occurredAt
) {
    public static OrderEventMessage from(OrderCreatedEvent event) {
        return new OrderEventMessage(
            "ORDER_CREATED",
            event.orderId(),
            event.orderNumber(),
            event.userId(),
            "PENDING",
            event.totalAmount(),
            LocalDateTime.now()
        );
    }

    public static OrderEventMessage from(OrderStatusChangedEvent event) {
        return new OrderEventMessage(
            "ORDER_STATUS_CHANGED",
            event.orderId(),
            event.orderNumber(),
            event.userId(),
            event.newStatus().name(),
            null,
            LocalDateTime.now()
        );
    }

    public static OrderEventMessage from(PaymentSettledEvent event) {
        return new OrderEventMessage(
            "PAYMENT_SETTLED",
            event.orderId(),
            event.orderNumber(),
            event.userId(),
            event.paymentStatus().name(),
            event.amount(),
            LocalDateTime.now()
        );
    }
}
