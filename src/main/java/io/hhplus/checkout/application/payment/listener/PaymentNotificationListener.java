package io.hhplus.checkout.application.payment.listener;

import io.hhplus.checkout.domain.notification.OrderNotificationSender;
import io.hhplus.checkout.domain.payment.PaymentSettledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentNotificationListener {

    private final OrderNotificationSender notificationSender;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handlePaymentSettled(PaymentSettledEvent event) {
        log.info("결제 결과 알림 발송 시작: orderId={}, paymentStatus={}, source={}",
            event.orderId(), event.paymentStatus(), event.source());
        try {
            notificationSender.sendPaymentResult(event);
        } catch (Exception e) {
            // 알림 실패는 결제 상태에 영향을 주지 않는다
            log.error("결제 결과 알림 발송 실패: orderId={}", event.orderId(), e);
        }
    }
}
