package io.hhplus.checkout.domain.order;

import java.math.BigDecimal;

/**
 * 주문 생성 완료 이벤트
 *
 * 발행 시점: 주문 저장 트랜잭션 내부 (리스너는 AFTER_COMMIT에 실행)
 * 처리: 주문 확인 메일, 실시간 주문 알림, Kafka 전달
 */
public record OrderCreatedEvent(
    Long orderId,
    String orderNumber,
    Long userId,
    BigDecimal totalAmount,
    PaymentMethod paymentMethod,
    int itemCount
) {
    public static OrderCreatedEvent from(Order order) {
        return new OrderCreatedEvent(
            order.getId(),
            order.getOrderNumber(),
            order.getUserId(),
            order.getTotalAmount(),
            order.getPaymentMethod(),
            order.getOrderItems().size()
        );
    }
}
