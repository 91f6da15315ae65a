package io.hhplus.checkout.domain.order;

/**
 * 주문의 결제 상태
 *
 * 전진만 허용한다: PENDING → PAID → REFUNDED, PENDING → FAILED
 * 어떤 상태에서도 PENDING으로 되돌아가지 않는다.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED;

    public boolean canTransitionTo(PaymentStatus next) {
        return switch (this) {
            case PENDING -> next == PAID || next == FAILED;
            case PAID -> next == REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }
}
