package io.hhplus.checkout.application.cart.dto;

import java.util.List;

/**
 * 장바구니 체크아웃 가능 여부
 *
 * @param empty  장바구니가 비어 있으면 true (valid=false)
 * @param items  검증을 통과한 아이템 (valid일 때만 주문에 사용)
 * @param issues 실패한 아이템 전체
 */
public record CartValidationResponse(
    boolean valid,
    boolean empty,
    List<CheckoutItem> items,
    List<CartItemIssue> issues
) {
    public static CartValidationResponse emptyCart() {
        return new CartValidationResponse(false, true, List.of(), List.of());
    }

    public static CartValidationResponse of(List<CheckoutItem> items, List<CartItemIssue> issues) {
        return new CartValidationResponse(issues.isEmpty(), false, items, issues);
    }
}
