package io.hhplus.checkout.presentation.api.order;

import io.hhplus.checkout.application.order.OrderService;
import io.hhplus.checkout.application.order.dto.*;
import io.hhplus.checkout.domain.order.OrderStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @GetMapping
    public ResponseEntity<OrderListResponse> getOrders(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(orderService.getOrders(userId, status, page, size));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable Long orderId
    ) {
        return ResponseEntity.ok(orderService.getOrder(userId, orderId));
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancel(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable Long orderId,
            @RequestBody(required = false) CancelOrderRequest request
    ) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(orderService.cancel(userId, orderId, reason));
    }

    /**
     * 주문 상태 진행 (운영/물류 시스템용)
     */
    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> advanceStatus(
            @PathVariable Long orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request
    ) {
        return ResponseEntity.ok(orderService.advanceStatus(orderId, request.status(), request.reason()));
    }
}
