package io.hhplus.checkout.domain.payment;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * PaymentIntent Entity
 *
 * 주문과 1:1 (order_id UNIQUE). 결제 대행사가 발급한 intent를 로컬에 미러링한다.
 *
 * 금액 추적:
 * - capturedAmount: 결제 성공 시 확정된 금액
 * - refundedAmount: 누적 환불 금액
 * - 환불 가능 금액 = capturedAmount - refundedAmount
 *
 * 상태는 confirm 응답과 웹훅으로만 갱신된다.
 */
@Entity
@Table(
    name = "payment_intents",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_payment_intent_order", columnNames = "order_id"),
        @UniqueConstraint(name = "uk_payment_intent_gateway_id", columnNames = "gateway_intent_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentIntent extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    @Column(name = "gateway_intent_id", nullable = false, length = 100, updatable = false)
    private String gatewayIntentId;

    @Column(name = "client_secret", length = 200)
    private String clientSecret;

    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private Currency currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentIntentStatus status;

    @Column(name = "captured_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal capturedAmount;

    @Column(name = "refunded_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal refundedAmount;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_intent_metadata", joinColumns = @JoinColumn(name = "payment_intent_id"))
    @MapKeyColumn(name = "meta_key", length = 100)
    @Column(name = "meta_value", length = 500)
    private Map<String, String> metadata = new HashMap<>();

    @Version
    private Long version;

    public static PaymentIntent create(Long orderId, String gatewayIntentId, String clientSecret,
                                       BigDecimal amount, Currency currency, Map<String, String> metadata) {
        validateOrderId(orderId);
        validateGatewayIntentId(gatewayIntentId);
        validateAmount(amount);

        PaymentIntent intent = new PaymentIntent();
        intent.orderId = orderId;
        intent.gatewayIntentId = gatewayIntentId;
        intent.clientSecret = clientSecret;
        intent.amount = amount.setScale(2, RoundingMode.HALF_UP);
        intent.currency = currency;
        intent.status = PaymentIntentStatus.REQUIRES_ACTION;
        intent.capturedAmount = BigDecimal.ZERO.setScale(2);
        intent.refundedAmount = BigDecimal.ZERO.setScale(2);
        if (metadata != null) {
            intent.metadata.putAll(metadata);
        }
        return intent;
    }

    /**
     * 결제 성공 반영 (멱등)
     *
     * @return 상태가 바뀌었으면 true
     */
    public boolean markSucceeded() {
        if (this.status == PaymentIntentStatus.SUCCEEDED) {
            return false;
        }
        validateNotTerminal(PaymentIntentStatus.SUCCEEDED);
        this.status = PaymentIntentStatus.SUCCEEDED;
        this.capturedAmount = this.amount;
        return true;
    }

    public boolean markFailed(String reason) {
        if (this.status == PaymentIntentStatus.FAILED) {
            return false;
        }
        validateNotTerminal(PaymentIntentStatus.FAILED);
        this.status = PaymentIntentStatus.FAILED;
        this.failureReason = reason;
        return true;
    }

    public boolean markCanceled() {
        if (this.status == PaymentIntentStatus.CANCELED) {
            return false;
        }
        validateNotTerminal(PaymentIntentStatus.CANCELED);
        this.status = PaymentIntentStatus.CANCELED;
        return true;
    }

    public BigDecimal getRefundableAmount() {
        return this.capturedAmount.subtract(this.refundedAmount);
    }

    /**
     * 환불 금액 누적
     * 환불 가능 금액을 넘는 요청은 거부한다.
     */
    public void recordRefund(BigDecimal refundAmount) {
        if (refundAmount == null || refundAmount.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_AMOUNT, "환불 금액은 0보다 커야 합니다");
        }
        if (refundAmount.compareTo(getRefundableAmount()) > 0) {
            throw new BusinessException(
                ErrorCode.REFUND_AMOUNT_EXCEEDS_CAPTURED,
                String.format("환불 가능 금액을 초과했습니다. 요청: %s, 환불 가능: %s", refundAmount, getRefundableAmount())
            );
        }
        this.refundedAmount = this.refundedAmount.add(refundAmount).setScale(2, RoundingMode.HALF_UP);
    }

    public boolean isFullyRefunded() {
        return this.capturedAmount.signum() > 0 && getRefundableAmount().signum() == 0;
    }

    public boolean isRequiresAction() {
        return this.status == PaymentIntentStatus.REQUIRES_ACTION;
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    // ====================================
    // Validation Methods
    // ====================================

    private void validateNotTerminal(PaymentIntentStatus next) {
        if (this.status.isTerminal()) {
            throw new BusinessException(
                ErrorCode.PAYMENT_INTENT_NOT_CONFIRMABLE,
                String.format("결제 요청 상태를 변경할 수 없습니다. 현재 상태: %s, 요청 상태: %s", this.status, next)
            );
        }
    }

    private static void validateOrderId(Long orderId) {
        if (orderId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 ID는 필수입니다");
        }
    }

    private static void validateGatewayIntentId(String gatewayIntentId) {
        if (gatewayIntentId == null || gatewayIntentId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "결제 대행사 intent ID는 필수입니다");
        }
    }

    private static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_AMOUNT, "결제 금액은 0보다 커야 합니다");
        }
    }
}
