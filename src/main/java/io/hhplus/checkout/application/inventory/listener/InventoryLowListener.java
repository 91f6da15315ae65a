package io.hhplus.checkout.application.inventory.listener;

import io.hhplus.checkout.domain.notification.RealtimeNotifier;
import io.hhplus.checkout.domain.product.InventoryLowEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryLowListener {

    private final RealtimeNotifier realtimeNotifier;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleInventoryLow(InventoryLowEvent event) {
        log.warn("재고 부족 임계치 도달: productId={}, name={}, remaining={}, threshold={}",
            event.productId(), event.productName(), event.remainingStock(), event.threshold());
        try {
            realtimeNotifier.pushInventoryUpdate(event.productId(), event.remainingStock());
        } catch (Exception e) {
            log.error("재고 알림 발송 실패: productId={}", event.productId(), e);
        }
    }
}
