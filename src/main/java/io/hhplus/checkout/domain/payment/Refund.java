package io.hhplus.checkout.domain.payment;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 환불 기록 (생성 후 변경 없음)
 */
@Entity
@Table(
    name = "refunds",
    indexes = {
        @Index(name = "idx_refund_order_id", columnList = "order_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Refund extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "payment_intent_id", nullable = false)
    private Long paymentIntentId;

    @Column(name = "gateway_refund_id", nullable = false, length = 100, unique = true)
    private String gatewayRefundId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private Currency currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private RefundReason reason;

    @Column(name = "full_refund", nullable = false)
    private boolean fullRefund;

    @Column(name = "gateway_status", length = 30)
    private String gatewayStatus;

    public static Refund create(PaymentIntent intent, String gatewayRefundId, BigDecimal amount,
                                RefundReason reason, boolean fullRefund, String gatewayStatus) {
        if (gatewayRefundId == null || gatewayRefundId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "결제 대행사 환불 ID는 필수입니다");
        }

        Refund refund = new Refund();
        refund.orderId = intent.getOrderId();
        refund.paymentIntentId = intent.getId();
        refund.gatewayRefundId = gatewayRefundId;
        refund.amount = amount;
        refund.currency = intent.getCurrency();
        refund.reason = reason != null ? reason : RefundReason.REQUESTED_BY_CUSTOMER;
        refund.fullRefund = fullRefund;
        refund.gatewayStatus = gatewayStatus;
        return refund;
    }
}
