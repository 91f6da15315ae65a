package io.hhplus.checkout.application.order.listener;

import io.hhplus.checkout.domain.notification.OrderNotificationSender;
import io.hhplus.checkout.domain.notification.RealtimeNotifier;
import io.hhplus.checkout.domain.order.OrderCreatedEvent;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.OrderStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 알림 리스너
 *
 * 커밋 이후 비동기로 실행되며, 알림 실패는 로그만 남기고 주문 흐름에 영향을 주지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderNotificationListener {

    private final OrderNotificationSender notificationSender;
    private final RealtimeNotifier realtimeNotifier;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleOrderCreated(OrderCreatedEvent event) {
        try {
            notificationSender.sendOrderConfirmation(event);
        } catch (Exception e) {
            log.error("주문 확인 메일 발송 실패: orderId={}", event.orderId(), e);
        }

        try {
            realtimeNotifier.pushOrderUpdate(event.userId(), event.orderId(), event.orderNumber(), OrderStatus.PENDING);
        } catch (Exception e) {
            log.error("실시간 주문 알림 실패: orderId={}", event.orderId(), e);
        }
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleOrderStatusChanged(OrderStatusChangedEvent event) {
        log.info("Order status changed: orderId={}, {} -> {}, reason={}",
            event.orderId(), event.previousStatus(), event.newStatus(), event.reason());
        try {
            realtimeNotifier.pushOrderUpdate(event.userId(), event.orderId(), event.orderNumber(), event.newStatus());
        } catch (Exception e) {
            log.error("실시간 주문 알림 실패: orderId={}", event.orderId(), e);
        }
    }
}
