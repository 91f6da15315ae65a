package io.hhplus.checkout.infrastructure.kafka;

import io.hhplus.checkout.domain.order.OrderCreatedEvent;
import io.hhplus.checkout.domain.order.OrderStatusChangedEvent;
import io.hhplus.checkout.domain.payment.PaymentSettledEvent;
import io.hhplus.checkout.infrastructure.kafka.message.OrderEventMessage;
import io.hhplus.checkout.infrastructure.kafka.producer.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 커밋된 주문 이벤트를 Kafka로 전달한다.
 * 발행 실패는 로그만 남긴다 (주문/결제 상태는 DB가 기준).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "checkout.events.kafka", name = "enabled", havingValue = "true")
public class OrderEventRelayListener {

    private final OrderEventProducer orderEventProducer;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void relayOrderCreated(OrderCreatedEvent event) {
        relay(OrderEventMessage.from(event));
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void relayOrderStatusChanged(OrderStatusChangedEvent event) {
        relay(OrderEventMessage.from(event));
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void relayPaymentSettled(PaymentSettledEvent event) {
        relay(OrderEventMessage.from(event));
    }

    private void relay(OrderEventMessage message) {
        try {
            orderEventProducer.publish(message);
        } catch (Exception e) {
            log.error("Kafka 전달 실패: type={}, orderId={}", message.eventType(), message.orderId(), e);
        }
    }
}
