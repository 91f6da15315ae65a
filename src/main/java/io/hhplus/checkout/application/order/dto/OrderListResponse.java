package io.hhplus.checkout.application.order.dto;

import io.hhplus.checkout.domain.order.Order;
import org.springframework.data.domain.Page;

import java.util.List;

public record OrderListResponse(
    List<OrderResponse> orders,
    int page,
    int size,
    long totalElements,
    int totalPages
) {
    public static OrderListResponse from(Page<Order> page) {
        return new OrderListResponse(
            page.getContent().stream().map(OrderResponse::from).toList(),
            page.getNumber(),
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages()
        );
    }
}
