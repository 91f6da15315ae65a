package io.hhplus.checkout.domain.order;

/**
 * 주문 상태 변경 이벤트 (진행, 취소, 결제 완료에 따른 확정)
 */
public record OrderStatusChangedEvent(
    Long orderId,
    String orderNumber,
    Long userId,
    OrderStatus previousStatus,
    OrderStatus newStatus,
    String reason
) {
    public static OrderStatusChangedEvent of(Order order, OrderStatus previousStatus, String reason) {
        return new OrderStatusChangedEvent(
            order.getId(),
            order.getOrderNumber(),
            order.getUserId(),
            previousStatus,
            order.getStatus(),
            reason
        );
    }
}
