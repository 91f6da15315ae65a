package io.hhplus.checkout.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusTest {

    @ParameterizedTest(name = "{0} -> {1} = {2}")
    @CsvSource({
        "PENDING, CONFIRMED, true",
        "CONFIRMED, PROCESSING, true",
        "PROCESSING, SHIPPED, true",
        "SHIPPED, DELIVERED, true",
        "PENDING, PROCESSING, false",
        "CONFIRMED, PENDING, false",
        "DELIVERED, CANCELLED, false",
        "CANCELLED, PENDING, false"
    })
    @DisplayName("주문 상태 전진 규칙")
    void canAdvanceTo(OrderStatus from, OrderStatus to, boolean expected) {
        assertThat(from.canAdvanceTo(to)).isEqualTo(expected);
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"PENDING", "CONFIRMED", "PROCESSING"})
    @DisplayName("취소 가능 상태")
    void isCancellable_true(OrderStatus status) {
        assertThat(status.isCancellable()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"SHIPPED", "DELIVERED", "CANCELLED"})
    @DisplayName("취소 불가 상태")
    void isCancellable_false(OrderStatus status) {
        assertThat(status.isCancellable()).isFalse();
    }

    @Test
    @DisplayName("결제 상태는 PENDING으로 되돌아가지 않음")
    void paymentStatus_되돌리기불가() {
        for (PaymentStatus status : PaymentStatus.values()) {
            assertThat(status.canTransitionTo(PaymentStatus.PENDING)).isFalse();
        }
        assertThat(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.PAID)).isTrue();
        assertThat(PaymentStatus.PAID.canTransitionTo(PaymentStatus.REFUNDED)).isTrue();
        assertThat(PaymentStatus.FAILED.canTransitionTo(PaymentStatus.PAID)).isFalse();
    }
}
