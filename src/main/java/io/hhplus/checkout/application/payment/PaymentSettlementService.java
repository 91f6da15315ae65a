package io.hhplus.checkout.application.payment;

import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.OrderStatusChangedEvent;
import io.hhplus.checkout.domain.order.PaymentStatus;
import io.hhplus.checkout.domain.payment.PaymentIntent;
import io.hhplus.checkout.domain.payment.PaymentIntentRepository;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;
import io.hhplus.checkout.domain.payment.PaymentSettledEvent;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 결제 결과 정산 (confirm 응답과 웹훅이 공유하는 경로)
 *
 * 멱등: 이미 반영된 결과나 허용되지 않는 전이는 무시하고 false를 반환한다.
 * - 주문 결제 상태는 PENDING → PAID, PENDING → FAILED만 반영한다
 * - 결제 성공 시 PENDING 주문은 CONFIRMED로 확정한다
 *
 * confirm 응답과 웹훅이 동시에 같은 주문을 갱신하면 @Version 충돌이 난다.
 * @Retryable이 트랜잭션 바깥에서 감싸므로 재시도마다 새 트랜잭션으로 최신 상태를 다시 읽는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentSettlementService {

    private final OrderRepository orderRepository;
    private final PaymentIntentRepository paymentIntentRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;

    /**
     * 결제 성공 반영
     *
     * @return 주문 결제 상태가 PAID로 바뀌었으면 true
     */
    @Retryable(
        retryFor = OptimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 50, multiplier = 2)
    )
    @Transactional
    public boolean settleSucceeded(Long orderId, String gatewayIntentId, String source) {
        Order order = orderRepository.findByIdOrThrow(orderId);

        paymentIntentRepository.findByGatewayIntentId(gatewayIntentId)
            .ifPresent(intent -> mirrorIntent(intent, PaymentIntentStatus.SUCCEEDED, null));

        if (!order.canTransitionPaymentTo(PaymentStatus.PAID)) {
            log.warn("결제 성공 반영 무시: orderId={}, paymentStatus={}, source={}",
                orderId, order.getPaymentStatus(), source);
            return false;
        }

        order.markPaid();
        OrderStatus previousStatus = order.getStatus();
        boolean confirmed = order.confirmIfPending();
        orderRepository.save(order);

        if (order.isCancelled()) {
            log.warn("취소된 주문에 결제가 완료되었습니다. 환불이 필요합니다: orderId={}, source={}", orderId, source);
        }

        eventPublisher.publishEvent(new PaymentSettledEvent(
            order.getId(), order.getOrderNumber(), order.getUserId(),
            PaymentStatus.PAID, order.getTotalAmount(), source
        ));
        if (confirmed) {
            eventPublisher.publishEvent(OrderStatusChangedEvent.of(order, previousStatus, "payment succeeded"));
        }
        metricsCollector.recordPaymentSuccess();

        log.info("결제 성공 반영: orderId={}, gatewayIntentId={}, confirmed={}, source={}",
            orderId, gatewayIntentId, confirmed, source);
        return true;
    }

    /**
     * 결제 실패/취소 반영
     *
     * @param canceled 대행사에서 intent가 취소된 경우 true (주문 결제 상태는 동일하게 FAILED)
     * @return 주문 결제 상태가 FAILED로 바뀌었으면 true
     */
    @Retryable(
        retryFor = OptimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 50, multiplier = 2)
    )
    @Transactional
    public boolean settleFailed(Long orderId, String gatewayIntentId, String failureReason,
                                boolean canceled, String source) {
        Order order = orderRepository.findByIdOrThrow(orderId);

        PaymentIntentStatus intentStatus = canceled ? PaymentIntentStatus.CANCELED : PaymentIntentStatus.FAILED;
        paymentIntentRepository.findByGatewayIntentId(gatewayIntentId)
            .ifPresent(intent -> mirrorIntent(intent, intentStatus, failureReason));

        if (!order.canTransitionPaymentTo(PaymentStatus.FAILED)) {
            log.warn("결제 실패 반영 무시: orderId={}, paymentStatus={}, source={}",
                orderId, order.getPaymentStatus(), source);
            return false;
        }

        order.markPaymentFailed();
        orderRepository.save(order);

        eventPublisher.publishEvent(new PaymentSettledEvent(
            order.getId(), order.getOrderNumber(), order.getUserId(),
            PaymentStatus.FAILED, order.getTotalAmount(), source
        ));
        metricsCollector.recordPaymentFailure();

        log.info("결제 실패 반영: orderId={}, gatewayIntentId={}, reason={}, canceled={}, source={}",
            orderId, gatewayIntentId, failureReason, canceled, source);
        return true;
    }

    /**
     * 로컬 intent 상태를 대행사 결과에 맞춘다. 종료 상태 간 전이는 무시한다.
     */
    private void mirrorIntent(PaymentIntent intent, PaymentIntentStatus target, String failureReason) {
        if (intent.getStatus() == target) {
            return;
        }
        if (!intent.isRequiresAction()) {
            log.warn("결제 요청 상태 전이 무시: paymentIntentId={}, current={}, target={}",
                intent.getId(), intent.getStatus(), target);
            return;
        }

        if (target == PaymentIntentStatus.SUCCEEDED) {
            intent.markSucceeded();
        } else if (target == PaymentIntentStatus.FAILED) {
            intent.markFailed(failureReason);
        } else if (target == PaymentIntentStatus.CANCELED) {
            intent.markCanceled();
        } else {
            return;
        }
        paymentIntentRepository.save(intent);
    }
}
