package io.hhplus.checkout.domain.order;

/**
 * 주문 상태
 *
 * PENDING → CONFIRMED → PROCESSING → SHIPPED → DELIVERED (한 단계씩 전진만 가능)
 * CANCELLED는 PENDING, CONFIRMED, PROCESSING에서만 도달할 수 있다.
 */
public enum OrderStatus {
    /**
     * 대기중 (주문 생성됨)
     */
    PENDING,

    /**
     * 확정 (결제 완료 또는 관리자 확인)
     */
    CONFIRMED,

    /**
     * 상품 준비중
     */
    PROCESSING,

    /**
     * 배송중
     */
    SHIPPED,

    /**
     * 배송 완료
     */
    DELIVERED,

    /**
     * 취소
     */
    CANCELLED;

    public boolean canAdvanceTo(OrderStatus next) {
        return switch (this) {
            case PENDING -> next == CONFIRMED;
            case CONFIRMED -> next == PROCESSING;
            case PROCESSING -> next == SHIPPED;
            case SHIPPED -> next == DELIVERED;
            case DELIVERED, CANCELLED -> false;
        };
    }

    public boolean isCancellable() {
        return this == PENDING || this == CONFIRMED || this == PROCESSING;
    }
}
