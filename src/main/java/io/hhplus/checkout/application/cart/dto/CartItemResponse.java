package io.hhplus.checkout.application.cart.dto;

import io.hhplus.checkout.domain.cart.CartItem;
import io.hhplus.checkout.domain.product.Product;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 장바구니 아이템 응답
 *
 * unitPrice는 현재 상품 가격, priceSnapshot은 담은 시점 가격이다.
 * subtotal은 현재 가격 기준으로 계산한다.
 */
public record CartItemResponse(
    Long cartItemId,
    Long productId,
    String productName,
    Integer quantity,
    BigDecimal unitPrice,
    BigDecimal priceSnapshot,
    BigDecimal subtotal,
    Integer availableStock,
    boolean available
) {
    public static CartItemResponse of(CartItem cartItem, Product product) {
        BigDecimal subtotal = product.getPrice()
            .multiply(BigDecimal.valueOf(cartItem.getQuantity()))
            .setScale(2, RoundingMode.HALF_UP);

        return new CartItemResponse(
            cartItem.getId(),
            product.getId(),
            product.getName(),
            cartItem.getQuantity(),
            product.getPrice(),
            cartItem.getPriceSnapshot(),
            subtotal,
            product.getStock(),
            product.isActive()
        );
    }
}
