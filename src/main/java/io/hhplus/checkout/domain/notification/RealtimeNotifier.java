package io.hhplus.checkout.domain.notification;

import io.hhplus.checkout.domain.order.OrderStatus;

/**
 * 실시간 푸시 알림 (주문 상태, 재고 변동)
 */
public interface RealtimeNotifier {

    void pushOrderUpdate(Long userId, Long orderId, String orderNumber, OrderStatus status);

    void pushInventoryUpdate(Long productId, int remainingStock);
}
