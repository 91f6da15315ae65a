package io.hhplus.checkout.application.payment;

import io.hhplus.checkout.application.payment.PaymentTransactionService.IntentPreparation;
import io.hhplus.checkout.application.payment.PaymentTransactionService.RefundPlan;
import io.hhplus.checkout.application.payment.dto.PaymentIntentResponse;
import io.hhplus.checkout.application.payment.dto.PaymentStatusResponse;
import io.hhplus.checkout.application.payment.dto.RefundResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.PaymentIntent;
import io.hhplus.checkout.domain.payment.PaymentIntentRepository;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;
import io.hhplus.checkout.domain.payment.RefundReason;
import io.hhplus.checkout.infrastructure.external.GatewayIntent;
import io.hhplus.checkout.infrastructure.external.GatewayRefund;
import io.hhplus.checkout.infrastructure.external.PaymentGatewayClient;
import io.hhplus.checkout.infrastructure.redis.DistributedLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * 결제 오케스트레이터
 * <p>
 * 외부 API 트랜잭션 분리:
 * - prepare (트랜잭션, 검증) → 대행사 호출 (트랜잭션 밖, 타임아웃) → 기록 (트랜잭션)
 * <p>
 * 동시성 제어:
 * - 결제 요청 생성, 환불: 주문별 분산락 (lock:payment:order:{orderId})
 * - 정산: @Version + 재시도 (PaymentSettlementService)
 * <p>
 * 대행사 타임아웃은 GATEWAY_TIMEOUT (결과 불명)으로 전파된다.
 * 호출 측은 getPaymentStatus로 상태를 확인한 뒤 재시도해야 한다.
 */
@Slf4j
@Service
public class PaymentService {

    private final PaymentTransactionService transactionService;
    private final PaymentSettlementService settlementService;
    private final PaymentGatewayClient gatewayClient;
    private final PaymentIntentRepository paymentIntentRepository;
    private final OrderRepository orderRepository;
    private final Currency defaultCurrency;

    public PaymentService(PaymentTransactionService transactionService,
                          PaymentSettlementService settlementService,
                          PaymentGatewayClient gatewayClient,
                          PaymentIntentRepository paymentIntentRepository,
                          OrderRepository orderRepository,
                          @Value("${checkout.payment.default-currency:usd}") String defaultCurrency) {
        this.transactionService = transactionService;
        this.settlementService = settlementService;
        this.gatewayClient = gatewayClient;
        this.paymentIntentRepository = paymentIntentRepository;
        this.orderRepository = orderRepository;
        this.defaultCurrency = Currency.from(defaultCurrency);
    }

    public Currency getDefaultCurrency() {
        return defaultCurrency;
    }

    /**
     * 결제 요청(PaymentIntent) 생성
     *
     * 승인 대기 중인 intent가 있으면 대행사를 호출하지 않고 그대로 반환한다.
     *
     * @param amount   null이면 주문 총액
     * @param currency null이면 기본 통화
     * @throws BusinessException ORDER_NOT_FOUND, ALREADY_PAID, ORDER_CANCELLED, PAYMENT_NOT_ALLOWED,
     *                           GATEWAY_ERROR, GATEWAY_TIMEOUT
     */
    @DistributedLock(key = "'lock:payment:order:' + #orderId")
    public PaymentIntentResponse createIntent(Long orderId, BigDecimal amount, Currency currency,
                                              Map<String, String> metadata) {
        // 1. 검증 (트랜잭션)
        IntentPreparation preparation = transactionService.prepareIntent(orderId, amount);
        if (preparation.hasExistingIntent()) {
            log.info("Returning existing payment intent. orderId: {}, paymentIntentId: {}",
                orderId, preparation.existingIntent().getId());
            return PaymentIntentResponse.from(preparation.existingIntent());
        }

        Currency resolvedCurrency = currency != null ? currency : defaultCurrency;
        Map<String, String> gatewayMetadata = new HashMap<>();
        if (metadata != null) {
            gatewayMetadata.putAll(metadata);
        }
        gatewayMetadata.put("orderId", String.valueOf(orderId));
        gatewayMetadata.put("orderNumber", preparation.orderNumber());
        gatewayMetadata.put("userId", String.valueOf(preparation.userId()));

        // 2. 대행사 호출 (트랜잭션 밖)
        GatewayIntent gatewayIntent = gatewayClient.createIntent(preparation.amount(), resolvedCurrency, gatewayMetadata);

        // 3. 저장 (트랜잭션)
        try {
            PaymentIntent saved = transactionService.saveIntent(orderId, gatewayIntent, resolvedCurrency, gatewayMetadata);
            log.info("Payment intent created. orderId: {}, paymentIntentId: {}, gatewayIntentId: {}, amount: {} {}",
                orderId, saved.getId(), saved.getGatewayIntentId(), saved.getAmount(), resolvedCurrency.getCode());
            return PaymentIntentResponse.from(saved);
        } catch (DataIntegrityViolationException e) {
            log.warn("Payment intent already exists for orderId: {}. Gateway intent {} is left unused",
                orderId, gatewayIntent.id());
            throw new BusinessException(
                ErrorCode.PAYMENT_INTENT_ALREADY_EXISTS,
                "이미 결제 요청이 존재합니다. orderId: " + orderId,
                e
            );
        }
    }

    /**
     * 결제 승인
     *
     * 대행사 결과를 로컬 intent에 반영하고, 성공/실패는 웹훅과 같은 정산 경로로 주문에 반영한다.
     * 카드 거절은 예외가 아니라 status=FAILED인 intent로 반환된다.
     *
     * @throws BusinessException PAYMENT_INTENT_NOT_FOUND, PAYMENT_INTENT_NOT_CONFIRMABLE, GATEWAY_ERROR, GATEWAY_TIMEOUT
     */
    public PaymentIntentResponse confirm(Long paymentIntentId, String paymentMethodId) {
        PaymentIntent intent = paymentIntentRepository.findByIdOrThrow(paymentIntentId);

        if (intent.getStatus() == PaymentIntentStatus.SUCCEEDED) {
            return PaymentIntentResponse.from(intent);
        }
        if (!intent.isRequiresAction()) {
            throw new BusinessException(
                ErrorCode.PAYMENT_INTENT_NOT_CONFIRMABLE,
                String.format("승인할 수 없는 결제 요청입니다. paymentIntentId: %d, status: %s", paymentIntentId, intent.getStatus())
            );
        }

        GatewayIntent result = gatewayClient.confirmIntent(intent.getGatewayIntentId(), paymentMethodId);
        log.info("Payment intent confirmed at gateway. paymentIntentId: {}, status: {}", paymentIntentId, result.status());

        switch (result.status()) {
            case SUCCEEDED -> settlementService.settleSucceeded(intent.getOrderId(), intent.getGatewayIntentId(), "confirm");
            case FAILED -> settlementService.settleFailed(
                intent.getOrderId(), intent.getGatewayIntentId(), result.failureMessage(), false, "confirm");
            case CANCELED -> settlementService.settleFailed(
                intent.getOrderId(), intent.getGatewayIntentId(), result.failureMessage(), true, "confirm");
            case REQUIRES_ACTION -> log.info("Payment intent still requires action. paymentIntentId: {}", paymentIntentId);
        }

        return PaymentIntentResponse.from(paymentIntentRepository.findByIdOrThrow(paymentIntentId));
    }

    /**
     * 환불
     *
     * @param amount null이면 남은 환불 가능 금액 전체
     * @param reason null이면 requested_by_customer
     * @throws BusinessException NOT_PAID, NO_PAYMENT_INTENT, REFUND_AMOUNT_EXCEEDS_CAPTURED, GATEWAY_ERROR, GATEWAY_TIMEOUT
     */
    @DistributedLock(key = "'lock:payment:order:' + #orderId")
    public RefundResponse refund(Long orderId, BigDecimal amount, RefundReason reason) {
        RefundReason resolvedReason = reason != null ? reason : RefundReason.REQUESTED_BY_CUSTOMER;

        // 1. 검증 (트랜잭션)
        RefundPlan plan = transactionService.prepareRefund(orderId, amount);

        // 2. 대행사 환불 (트랜잭션 밖)
        GatewayRefund gatewayRefund = gatewayClient.createRefund(
            plan.gatewayIntentId(),
            plan.amount(),
            resolvedReason,
            Map.of("orderId", String.valueOf(orderId))
        );

        // 3. 기록 (트랜잭션)
        try {
            return transactionService.recordRefund(plan, gatewayRefund, resolvedReason);
        } catch (RuntimeException e) {
            log.error("Refund succeeded at gateway but recording failed. orderId: {}, gatewayRefundId: {}, amount: {}. "
                + "Manual intervention required!", orderId, gatewayRefund.id(), plan.amount(), e);
            throw e;
        }
    }

    /**
     * 주문 결제 상태 조회
     *
     * 대행사 실시간 상태 조회에 실패하면 경고만 남기고 gatewayStatus를 비운다.
     */
    public PaymentStatusResponse getPaymentStatus(Long orderId) {
        Order order = orderRepository.findByIdOrThrow(orderId);
        PaymentIntent intent = paymentIntentRepository.findByOrderId(orderId).orElse(null);

        PaymentIntentStatus gatewayStatus = null;
        if (intent != null) {
            try {
                gatewayStatus = gatewayClient.retrieveIntent(intent.getGatewayIntentId()).status();
            } catch (BusinessException e) {
                log.warn("Failed to retrieve payment intent from gateway. orderId: {}, gatewayIntentId: {}, error: {}",
                    orderId, intent.getGatewayIntentId(), e.getMessage());
            }
        }

        return new PaymentStatusResponse(
            order.getId(),
            order.getOrderNumber(),
            order.getStatus(),
            order.getPaymentStatus(),
            order.getTotalAmount(),
            intent != null ? intent.getId() : null,
            intent != null ? intent.getGatewayIntentId() : null,
            intent != null ? intent.getStatus() : null,
            gatewayStatus
        );
    }
}
