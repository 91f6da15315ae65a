package io.hhplus.checkout.infrastructure.notification;

import io.hhplus.checkout.domain.notification.OrderNotificationSender;
import io.hhplus.checkout.domain.order.OrderCreatedEvent;
import io.hhplus.checkout.domain.payment.PaymentSettledEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 알림 발송 구현 (로그 출력)
 * 메일 발송 서버 연동 전까지 발송 내용을 로그로 남긴다.
 */
@Slf4j
@Component
public class LoggingOrderNotificationSender implements OrderNotificationSender {

    @Override
    public void sendOrderConfirmation(OrderCreatedEvent event) {
        log.info("[MAIL] 주문 확인 메일 발송: userId={}, orderNumber={}, totalAmount={}, items={}",
            event.userId(), event.orderNumber(), event.totalAmount(), event.itemCount());
    }

    @Override
    public void sendPaymentResult(PaymentSettledEvent event) {
        log.info("[MAIL] 결제 결과 메일 발송: userId={}, orderNumber={}, paymentStatus={}, amount={}",
            event.userId(), event.orderNumber(), event.paymentStatus(), event.amount());
    }
}
