package io.hhplus.checkout.application.payment;

import io.hhplus.checkout.application.payment.dto.RefundResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.domain.order.PaymentStatus;
import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.PaymentIntent;
import io.hhplus.checkout.domain.payment.PaymentIntentRepository;
import io.hhplus.checkout.domain.payment.PaymentSettledEvent;
import io.hhplus.checkout.domain.payment.Refund;
import io.hhplus.checkout.domain.payment.RefundReason;
import io.hhplus.checkout.domain.payment.RefundRepository;
import io.hhplus.checkout.infrastructure.external.GatewayIntent;
import io.hhplus.checkout.infrastructure.external.GatewayRefund;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 결제 트랜잭션 구간
 *
 * 대행사 호출은 트랜잭션 밖(PaymentService)에서 하고, 호출 전후의 DB 작업만 짧은 트랜잭션으로 처리한다.
 * - prepareIntent / saveIntent: 결제 요청 생성 전 검증, 생성 후 저장
 * - prepareRefund / recordRefund: 환불 전 검증, 환불 후 기록
 */
@Slf4j
@Service
public class PaymentTransactionService {

    private final OrderRepository orderRepository;
    private final PaymentIntentRepository paymentIntentRepository;
    private final RefundRepository refundRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;
    private final boolean partialRefundMarksRefunded;

    public PaymentTransactionService(OrderRepository orderRepository,
                                     PaymentIntentRepository paymentIntentRepository,
                                     RefundRepository refundRepository,
                                     ApplicationEventPublisher eventPublisher,
                                     MetricsCollector metricsCollector,
                                     @Value("${checkout.payment.partial-refund-marks-refunded:false}") boolean partialRefundMarksRefunded) {
        this.orderRepository = orderRepository;
        this.paymentIntentRepository = paymentIntentRepository;
        this.refundRepository = refundRepository;
        this.eventPublisher = eventPublisher;
        this.metricsCollector = metricsCollector;
        this.partialRefundMarksRefunded = partialRefundMarksRefunded;
    }

    /**
     * 결제 요청 생성 전 검증
     *
     * 검사 순서:
     * 1. 결제 완료 주문 → ALREADY_PAID
     * 2. 취소된 주문 → ORDER_CANCELLED
     * 3. 승인 대기 intent가 이미 있으면 그대로 반환 (주문당 하나)
     * 4. 결제 상태가 PENDING이 아니거나 종료된 intent가 있음 → PAYMENT_NOT_ALLOWED
     * 5. 요청 금액이 주문 총액과 다르면 INVALID_PAYMENT_AMOUNT
     */
    @Transactional(readOnly = true)
    public IntentPreparation prepareIntent(Long orderId, BigDecimal requestedAmount) {
        Order order = orderRepository.findByIdOrThrow(orderId);

        if (order.isPaid()) {
            throw new BusinessException(
                ErrorCode.ALREADY_PAID,
                "이미 결제된 주문입니다. orderId: " + orderId
            );
        }
        if (order.isCancelled()) {
            throw new BusinessException(
                ErrorCode.ORDER_CANCELLED,
                "취소된 주문은 결제할 수 없습니다. orderId: " + orderId
            );
        }

        PaymentIntent existing = paymentIntentRepository.findByOrderId(orderId).orElse(null);
        if (existing != null && existing.isRequiresAction()) {
            return IntentPreparation.existing(existing);
        }
        if (existing != null || order.getPaymentStatus() != PaymentStatus.PENDING) {
            throw new BusinessException(
                ErrorCode.PAYMENT_NOT_ALLOWED,
                String.format("결제를 진행할 수 없습니다. orderId: %d, paymentStatus: %s", orderId, order.getPaymentStatus())
            );
        }

        if (requestedAmount != null && requestedAmount.compareTo(order.getTotalAmount()) != 0) {
            throw new BusinessException(
                ErrorCode.INVALID_PAYMENT_AMOUNT,
                String.format("결제 금액이 주문 금액과 다릅니다. 요청: %s, 주문: %s", requestedAmount, order.getTotalAmount())
            );
        }

        return IntentPreparation.create(order.getId(), order.getOrderNumber(), order.getUserId(), order.getTotalAmount());
    }

    @Transactional
    public PaymentIntent saveIntent(Long orderId, GatewayIntent gatewayIntent, Currency currency,
                                    Map<String, String> metadata) {
        PaymentIntent intent = PaymentIntent.create(
            orderId,
            gatewayIntent.id(),
            gatewayIntent.clientSecret(),
            gatewayIntent.amount(),
            currency,
            metadata
        );
        return paymentIntentRepository.save(intent);
    }

    /**
     * 환불 전 검증
     *
     * amount가 null이면 남은 환불 가능 금액 전체.
     *
     * @throws BusinessException NOT_PAID, NO_PAYMENT_INTENT, INVALID_PAYMENT_AMOUNT, REFUND_AMOUNT_EXCEEDS_CAPTURED
     */
    @Transactional(readOnly = true)
    public RefundPlan prepareRefund(Long orderId, BigDecimal requestedAmount) {
        Order order = orderRepository.findByIdOrThrow(orderId);

        if (!order.isPaid()) {
            throw new BusinessException(
                ErrorCode.NOT_PAID,
                String.format("결제 완료 상태가 아닌 주문은 환불할 수 없습니다. orderId: %d, paymentStatus: %s",
                    orderId, order.getPaymentStatus())
            );
        }

        PaymentIntent intent = paymentIntentRepository.findByOrderId(orderId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.NO_PAYMENT_INTENT,
                "주문에 연결된 결제 요청이 없습니다. orderId: " + orderId
            ));

        BigDecimal refundable = intent.getRefundableAmount();
        BigDecimal amount = requestedAmount != null ? requestedAmount : refundable;

        if (amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_AMOUNT, "환불 금액은 0보다 커야 합니다");
        }
        if (amount.compareTo(refundable) > 0) {
            throw new BusinessException(
                ErrorCode.REFUND_AMOUNT_EXCEEDS_CAPTURED,
                String.format("환불 가능 금액을 초과했습니다. 요청: %s, 환불 가능: %s", amount, refundable)
            );
        }

        return new RefundPlan(orderId, intent.getId(), intent.getGatewayIntentId(), amount,
            amount.compareTo(refundable) == 0);
    }

    /**
     * 환불 기록
     *
     * 누적 환불이 결제 금액과 같아지면 주문 결제 상태를 REFUNDED로 바꾼다.
     * checkout.payment.partial-refund-marks-refunded=true이면 부분 환불도 REFUNDED로 바꾼다.
     */
    @Transactional
    public RefundResponse recordRefund(RefundPlan plan, GatewayRefund gatewayRefund, RefundReason reason) {
        Order order = orderRepository.findByIdOrThrow(plan.orderId());
        PaymentIntent intent = paymentIntentRepository.findByIdOrThrow(plan.paymentIntentId());

        intent.recordRefund(plan.amount());
        paymentIntentRepository.save(intent);

        boolean fullRefund = intent.isFullyRefunded();
        Refund refund = refundRepository.save(
            Refund.create(intent, gatewayRefund.id(), plan.amount(), reason, fullRefund, gatewayRefund.status())
        );

        if (fullRefund || partialRefundMarksRefunded) {
            order.markRefunded();
            orderRepository.save(order);

            eventPublisher.publishEvent(new PaymentSettledEvent(
                order.getId(), order.getOrderNumber(), order.getUserId(),
                PaymentStatus.REFUNDED, plan.amount(), "refund"
            ));
        }
        metricsCollector.recordRefund(fullRefund);

        log.info("환불 기록: orderId={}, refundId={}, amount={}, fullRefund={}, paymentStatus={}",
            order.getId(), refund.getId(), plan.amount(), fullRefund, order.getPaymentStatus());

        return RefundResponse.of(refund, order.getPaymentStatus(), intent.getRefundableAmount());
    }

    /**
     * 결제 요청 생성 준비 결과
     *
     * existingIntent가 있으면 대행사를 호출하지 않고 그대로 반환한다.
     */
    public record IntentPreparation(
        PaymentIntent existingIntent,
        Long orderId,
        String orderNumber,
        Long userId,
        BigDecimal amount
    ) {
        static IntentPreparation existing(PaymentIntent intent) {
            return new IntentPreparation(intent, intent.getOrderId(), null, null, intent.getAmount());
        }

        static IntentPreparation create(Long orderId, String orderNumber, Long userId, BigDecimal amount) {
            return new IntentPreparation(null, orderId, orderNumber, userId, amount);
        }

        public boolean hasExistingIntent() {
            return existingIntent != null;
        }
    }

    public record RefundPlan(
        Long orderId,
        Long paymentIntentId,
        String gatewayIntentId,
        BigDecimal amount,
        boolean coversRemainingBalance
    ) {}
}
