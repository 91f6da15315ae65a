package io.hhplus.checkout.application.order.dto;

import io.hhplus.checkout.domain.order.OrderItem;

import java.math.BigDecimal;

public record OrderItemResponse(
    Long productId,
    String productName,
    Integer quantity,
    BigDecimal unitPrice,
    BigDecimal subtotal
) {
    public static OrderItemResponse from(OrderItem orderItem) {
        return new OrderItemResponse(
            orderItem.getProductId(),
            orderItem.getProductName(),
            orderItem.getQuantity(),
            orderItem.getUnitPrice(),
            orderItem.getSubtotal()
        );
    }
}
