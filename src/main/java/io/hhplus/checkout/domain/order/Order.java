package io.hhplus.checkout.domain.order;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Order Entity (주문 집합 루트)
 *
 * 1. 식별자(id, orderNumber)는 불변, status/paymentStatus만 변경된다
 * 2. 상태 변경은 명시적인 메서드(advanceTo, cancel, markPaid ...)로만 가능하다
 * 3. 주문 항목의 단가/수량은 생성 시점에 고정된다 (OrderItem 참고)
 * 4. 삭제하지 않는다. 취소는 상태 전이다
 */
@Entity
@Table(
    name = "orders",
    indexes = {
        @Index(name = "idx_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_user_status", columnList = "user_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order extends BaseTimeEntity {

    public static final int MAX_NOTES_LENGTH = 500;

    private static final DateTimeFormatter ORDER_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_number", unique = true, length = 30, nullable = false, updatable = false)
    private String orderNumber;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private List<OrderItem> orderItems = new ArrayList<>();

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "recipientName", column = @Column(name = "shipping_recipient_name", length = 100)),
        @AttributeOverride(name = "line1", column = @Column(name = "shipping_line1", length = 200)),
        @AttributeOverride(name = "line2", column = @Column(name = "shipping_line2", length = 200)),
        @AttributeOverride(name = "city", column = @Column(name = "shipping_city", length = 100)),
        @AttributeOverride(name = "state", column = @Column(name = "shipping_state", length = 100)),
        @AttributeOverride(name = "postalCode", column = @Column(name = "shipping_postal_code", length = 20)),
        @AttributeOverride(name = "country", column = @Column(name = "shipping_country", length = 2)),
        @AttributeOverride(name = "phone", column = @Column(name = "shipping_phone", length = 30))
    })
    private Address shippingAddress;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "recipientName", column = @Column(name = "billing_recipient_name", length = 100)),
        @AttributeOverride(name = "line1", column = @Column(name = "billing_line1", length = 200)),
        @AttributeOverride(name = "line2", column = @Column(name = "billing_line2", length = 200)),
        @AttributeOverride(name = "city", column = @Column(name = "billing_city", length = 100)),
        @AttributeOverride(name = "state", column = @Column(name = "billing_state", length = 100)),
        @AttributeOverride(name = "postalCode", column = @Column(name = "billing_postal_code", length = 20)),
        @AttributeOverride(name = "country", column = @Column(name = "billing_country", length = 2)),
        @AttributeOverride(name = "phone", column = @Column(name = "billing_phone", length = 30))
    })
    private Address billingAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 30, updatable = false)
    private PaymentMethod paymentMethod;

    @Column(length = MAX_NOTES_LENGTH)
    private String notes;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Version
    private Long version;

    /**
     * 주문 생성 (status=PENDING, paymentStatus=PENDING)
     * 청구지가 없으면 배송지를 청구지로 사용한다.
     */
    public static Order create(String orderNumber, Long userId, Address shippingAddress, Address billingAddress,
                               PaymentMethod paymentMethod, String notes) {
        validateOrderNumber(orderNumber);
        validateUserId(userId);
        validateShippingAddress(shippingAddress);
        validatePaymentMethod(paymentMethod);
        validateNotes(notes);

        Order order = new Order();
        order.orderNumber = orderNumber;
        order.userId = userId;
        order.shippingAddress = shippingAddress;
        order.billingAddress = billingAddress != null ? billingAddress : shippingAddress.copy();
        order.paymentMethod = paymentMethod;
        order.notes = notes;
        order.totalAmount = BigDecimal.ZERO.setScale(2);
        order.status = OrderStatus.PENDING;
        order.paymentStatus = PaymentStatus.PENDING;
        return order;
    }

    /**
     * 주문 번호 생성: ORD-yyyyMMdd-XXXXXXXX
     */
    public static String generateOrderNumber(LocalDate orderDate) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "ORD-" + orderDate.format(ORDER_DATE_FORMAT) + "-" + suffix;
    }

    /**
     * OrderItem.create에서 호출 (양방향 관계 동기화 + 합계 재계산)
     */
    void addOrderItem(OrderItem orderItem) {
        this.orderItems.add(orderItem);
        this.totalAmount = this.orderItems.stream()
            .map(OrderItem::getSubtotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    // ====================================
    // 주문 상태 전이
    // ====================================

    public OrderStatus advanceTo(OrderStatus next) {
        if (next == null || !this.status.canAdvanceTo(next)) {
            throw new BusinessException(
                ErrorCode.INVALID_ORDER_STATUS_TRANSITION,
                String.format("주문 상태를 변경할 수 없습니다. 현재 상태: %s, 요청 상태: %s", this.status, next)
            );
        }
        OrderStatus previous = this.status;
        this.status = next;
        return previous;
    }

    public OrderStatus cancel(String reason) {
        if (!this.status.isCancellable()) {
            throw new BusinessException(
                ErrorCode.ORDER_NOT_CANCELLABLE,
                String.format("주문을 취소할 수 없습니다 (cannot be cancelled). 현재 상태: %s", this.status)
            );
        }
        OrderStatus previous = this.status;
        this.status = OrderStatus.CANCELLED;
        this.cancellationReason = reason;
        this.cancelledAt = LocalDateTime.now();
        return previous;
    }

    /**
     * 결제 완료 시 대기 주문을 확정한다. 이미 진행된 주문은 그대로 둔다.
     *
     * @return 상태가 바뀌었으면 true
     */
    public boolean confirmIfPending() {
        if (this.status != OrderStatus.PENDING) {
            return false;
        }
        this.status = OrderStatus.CONFIRMED;
        return true;
    }

    // ====================================
    // 결제 상태 전이
    // ====================================

    public void markPaid() {
        transitionPaymentStatus(PaymentStatus.PAID);
        this.paidAt = LocalDateTime.now();
    }

    public void markPaymentFailed() {
        transitionPaymentStatus(PaymentStatus.FAILED);
    }

    public void markRefunded() {
        transitionPaymentStatus(PaymentStatus.REFUNDED);
    }

    public boolean canTransitionPaymentTo(PaymentStatus next) {
        return this.paymentStatus.canTransitionTo(next);
    }

    private void transitionPaymentStatus(PaymentStatus next) {
        if (!this.paymentStatus.canTransitionTo(next)) {
            throw new BusinessException(
                ErrorCode.INVALID_PAYMENT_STATUS_TRANSITION,
                String.format("결제 상태를 변경할 수 없습니다. 현재 상태: %s, 요청 상태: %s", this.paymentStatus, next)
            );
        }
        this.paymentStatus = next;
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    public boolean isCancelled() {
        return this.status == OrderStatus.CANCELLED;
    }

    public boolean isPaid() {
        return this.paymentStatus == PaymentStatus.PAID;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateOrderNumber(String orderNumber) {
        if (orderNumber == null || orderNumber.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 번호는 필수입니다");
        }
    }

    private static void validateUserId(Long userId) {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "사용자 ID는 필수입니다");
        }
    }

    private static void validateShippingAddress(Address shippingAddress) {
        if (shippingAddress == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "배송지는 필수입니다");
        }
    }

    private static void validatePaymentMethod(PaymentMethod paymentMethod) {
        if (paymentMethod == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "결제 수단은 필수입니다");
        }
    }

    private static void validateNotes(String notes) {
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("요청사항은 %d자 이하여야 합니다", MAX_NOTES_LENGTH)
            );
        }
    }
}
