package io.hhplus.checkout.domain.notification;

import io.hhplus.checkout.domain.order.OrderCreatedEvent;
import io.hhplus.checkout.domain.payment.PaymentSettledEvent;

/**
 * 주문 관련 고객 알림 발송 (메일 등)
 * 발송 실패는 예외로 알리고, 호출 측은 주문 흐름에 영향을 주지 않도록 처리한다.
 */
public interface OrderNotificationSender {

    void sendOrderConfirmation(OrderCreatedEvent event);

    void sendPaymentResult(PaymentSettledEvent event);
}
