package io.hhplus.checkout.application.cart.dto;

import java.math.BigDecimal;

/**
 * 검증을 통과한 주문 대상 아이템 (가격은 검증 시점의 상품 가격)
 */
public record CheckoutItem(
    Long productId,
    String productName,
    int quantity,
    BigDecimal unitPrice
) {}
