package io.hhplus.checkout.application.order.dto;

import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.PaymentMethod;
import io.hhplus.checkout.domain.order.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderResponse(
    Long orderId,
    String orderNumber,
    Long userId,
    OrderStatus status,
    PaymentStatus paymentStatus,
    PaymentMethod paymentMethod,
    BigDecimal totalAmount,
    List<OrderItemResponse> items,
    AddressResponse shippingAddress,
    AddressResponse billingAddress,
    String notes,
    String cancellationReason,
    LocalDateTime createdAt,
    LocalDateTime paidAt,
    LocalDateTime cancelledAt
) {
    public static OrderResponse from(Order order) {
        List<OrderItemResponse> items = order.getOrderItems().stream()
            .map(OrderItemResponse::from)
            .toList();

        return new OrderResponse(
            order.getId(),
            order.getOrderNumber(),
            order.getUserId(),
            order.getStatus(),
            order.getPaymentStatus(),
            order.getPaymentMethod(),
            order.getTotalAmount(),
            items,
            AddressResponse.from(order.getShippingAddress()),
            AddressResponse.from(order.getBillingAddress()),
            order.getNotes(),
            order.getCancellationReason(),
            order.getCreatedAt(),
            order.getPaidAt(),
            order.getCancelledAt()
        );
    }
}
