package io.hhplus.checkout.application.cart.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public record CartResponse(
    Long userId,
    List<CartItemResponse> items,
    CartSummary summary
) {
    public static CartResponse of(Long userId, List<CartItemResponse> items) {
        return new CartResponse(userId, items, CartSummary.of(items));
    }

    public static CartResponse empty(Long userId) {
        return of(userId, List.of());
    }

    /**
     * @param itemCount     아이템(상품) 종류 수
     * @param totalQuantity 전체 수량 합
     * @param totalAmount   현재 가격 기준 합계 (소수점 2자리)
     */
    public record CartSummary(
        int itemCount,
        int totalQuantity,
        BigDecimal totalAmount
    ) {
        public static CartSummary of(List<CartItemResponse> items) {
            int totalQuantity = items.stream()
                .mapToInt(CartItemResponse::quantity)
                .sum();
            BigDecimal totalAmount = items.stream()
                .map(CartItemResponse::subtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);

            return new CartSummary(items.size(), totalQuantity, totalAmount);
        }
    }
}
