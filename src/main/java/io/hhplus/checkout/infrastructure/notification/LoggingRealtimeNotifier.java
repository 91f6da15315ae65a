package io.hhplus.checkout.infrastructure.notification;

import io.hhplus.checkout.domain.notification.RealtimeNotifier;
import io.hhplus.checkout.domain.order.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingRealtimeNotifier implements RealtimeNotifier {

    @Override
    public void pushOrderUpdate(Long userId, Long orderId, String orderNumber, OrderStatus status) {
        log.info("[PUSH] order update: userId={}, orderId={}, orderNumber={}, status={}",
            userId, orderId, orderNumber, status);
    }

    @Override
    public void pushInventoryUpdate(Long productId, int remainingStock) {
        log.info("[PUSH] inventory update: productId={}, remainingStock={}", productId, remainingStock);
    }
}
