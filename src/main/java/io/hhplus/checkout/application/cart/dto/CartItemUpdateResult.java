package io.hhplus.checkout.application.cart.dto;

/**
 * 수량 변경 결과
 *
 * REMOVED이면 item은 null이다.
 */
public record CartItemUpdateResult(
    Outcome outcome,
    Long cartItemId,
    CartItemResponse item
) {
    public enum Outcome {
        UPDATED,
        REMOVED
    }

    public static CartItemUpdateResult updated(CartItemResponse item) {
        return new CartItemUpdateResult(Outcome.UPDATED, item.cartItemId(), item);
    }

    public static CartItemUpdateResult removed(Long cartItemId) {
        return new CartItemUpdateResult(Outcome.REMOVED, cartItemId, null);
    }
}
