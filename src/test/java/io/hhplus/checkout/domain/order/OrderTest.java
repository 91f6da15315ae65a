package io.hhplus.checkout.domain.order;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class OrderTest {

    private static final Address ADDRESS =
        Address.of("김항해", "테헤란로 1", null, "서울", "서울", "06000", "KR", "010-0000-0000");

    private Order newOrder(PaymentMethod paymentMethod) {
        return Order.create("ORD-20250101-ABCDEF12", 1L, ADDRESS, null, paymentMethod, null);
    }

    @Test
    @DisplayName("주문 생성 - PENDING/PENDING, 청구지는 배송지로 대체")
    void create_성공() {
        // When
        Order order = newOrder(PaymentMethod.CREDIT_CARD);

        // Then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(order.getBillingAddress().getLine1()).isEqualTo("테헤란로 1");
        assertThat(order.getTotalAmount()).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("주문 생성 실패 - 요청사항 500자 초과")
    void create_요청사항초과_예외발생() {
        String notes = "a".repeat(501);

        assertThatThrownBy(() -> Order.create("ORD-1", 1L, ADDRESS, null, PaymentMethod.CASH_ON_DELIVERY, notes))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("주문 항목 추가 시 합계 = 단가 x 수량의 합")
    void addOrderItem_합계계산() {
        // Given
        Order order = newOrder(PaymentMethod.CREDIT_CARD);

        // When
        OrderItem.create(order, 1L, "키보드", 2, new BigDecimal("19.99"));
        OrderItem.create(order, 2L, "마우스", 1, new BigDecimal("5.01"));

        // Then
        assertThat(order.getOrderItems()).hasSize(2);
        assertThat(order.getTotalAmount()).isEqualByComparingTo("44.99");
    }

    @Test
    @DisplayName("주문 번호 형식: ORD-yyyyMMdd-8자리")
    void generateOrderNumber_형식() {
        String orderNumber = Order.generateOrderNumber(LocalDate.of(2025, 1, 12));

        assertThat(orderNumber).matches("ORD-20250112-[0-9A-F]{8}");
    }

    @Test
    @DisplayName("상태 진행 - 한 단계씩만 가능")
    void advanceTo_순차진행() {
        Order order = newOrder(PaymentMethod.CASH_ON_DELIVERY);

        assertThat(order.advanceTo(OrderStatus.CONFIRMED)).isEqualTo(OrderStatus.PENDING);
        order.advanceTo(OrderStatus.PROCESSING);
        order.advanceTo(OrderStatus.SHIPPED);
        order.advanceTo(OrderStatus.DELIVERED);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.DELIVERED);
    }

    @Test
    @DisplayName("상태 진행 실패 - 단계 건너뛰기")
    void advanceTo_건너뛰기_예외발생() {
        Order order = newOrder(PaymentMethod.CASH_ON_DELIVERY);

        assertThatThrownBy(() -> order.advanceTo(OrderStatus.SHIPPED))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_ORDER_STATUS_TRANSITION);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    @DisplayName("취소 - 사유와 취소 시각 기록")
    void cancel_성공() {
        Order order = newOrder(PaymentMethod.CASH_ON_DELIVERY);

        OrderStatus previous = order.cancel("단순 변심");

        assertThat(previous).isEqualTo(OrderStatus.PENDING);
        assertThat(order.isCancelled()).isTrue();
        assertThat(order.getCancellationReason()).isEqualTo("단순 변심");
        assertThat(order.getCancelledAt()).isNotNull();
    }

    @Test
    @DisplayName("취소 실패 - 배송중 주문")
    void cancel_배송중_예외발생() {
        Order order = newOrder(PaymentMethod.CASH_ON_DELIVERY);
        order.advanceTo(OrderStatus.CONFIRMED);
        order.advanceTo(OrderStatus.PROCESSING);
        order.advanceTo(OrderStatus.SHIPPED);

        assertThatThrownBy(() -> order.cancel("변심"))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ORDER_NOT_CANCELLABLE);
    }

    @Test
    @DisplayName("결제 완료 - paidAt 기록, 대기 주문은 확정")
    void markPaid_confirmIfPending() {
        Order order = newOrder(PaymentMethod.CREDIT_CARD);

        order.markPaid();
        boolean confirmed = order.confirmIfPending();

        assertThat(order.isPaid()).isTrue();
        assertThat(order.getPaidAt()).isNotNull();
        assertThat(confirmed).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(order.confirmIfPending()).isFalse();
    }

    @Test
    @DisplayName("결제 상태는 되돌아가지 않음 - FAILED 이후 PAID 불가")
    void markPaid_실패이후_예외발생() {
        Order order = newOrder(PaymentMethod.CREDIT_CARD);
        order.markPaymentFailed();

        assertThat(order.canTransitionPaymentTo(PaymentStatus.PAID)).isFalse();
        assertThatThrownBy(order::markPaid)
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PAYMENT_STATUS_TRANSITION);
    }

    @Test
    @DisplayName("환불 - PAID에서만 REFUNDED로 전이")
    void markRefunded() {
        Order order = newOrder(PaymentMethod.CREDIT_CARD);

        assertThatThrownBy(order::markRefunded)
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PAYMENT_STATUS_TRANSITION);

        order.markPaid();
        order.markRefunded();

        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
    }
}
