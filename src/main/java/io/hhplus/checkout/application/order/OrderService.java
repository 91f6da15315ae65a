package io.hhplus.checkout.application.order;

import io.hhplus.checkout.application.inventory.InventoryService;
import io.hhplus.checkout.application.order.dto.OrderListResponse;
import io.hhplus.checkout.application.order.dto.OrderResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderItem;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.OrderStatusChangedEvent;
import io.hhplus.checkout.domain.order.PaymentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 주문 조회/상태 변경
 *
 * 상태 전이 규칙은 Order/OrderStatus가 가진다. 서비스는 조회, 이벤트 발행, 재고 복원을 담당한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private static final int MAX_PAGE_SIZE = 100;

    private final OrderRepository orderRepository;
    private final InventoryService inventoryService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public OrderResponse getOrder(Long userId, Long orderId) {
        return OrderResponse.from(findOwnedOrder(userId, orderId));
    }

    /**
     * 사용자 주문 목록 (최신순)
     *
     * @param status null이면 전체
     */
    @Transactional(readOnly = true)
    public OrderListResponse getOrders(Long userId, OrderStatus status, int page, int size) {
        validatePage(page, size);
        Page<Order> orders = orderRepository.findByUserIdAndStatus(userId, status, PageRequest.of(page, size));
        return OrderListResponse.from(orders);
    }

    /**
     * 전체 주문 목록 (관리자, 최신순)
     * 상태를 진행시킬 주문을 찾는 용도. 모든 필터는 선택이다.
     */
    @Transactional(readOnly = true)
    public OrderListResponse getAllOrders(OrderStatus status, PaymentStatus paymentStatus, Long userId, int page, int size) {
        validatePage(page, size);
        Page<Order> orders = orderRepository.search(status, paymentStatus, userId, PageRequest.of(page, size));
        log.debug("관리자 주문 조회: status={}, paymentStatus={}, userId={}, total={}",
            status, paymentStatus, userId, orders.getTotalElements());
        return OrderListResponse.from(orders);
    }

    /**
     * 주문 상태를 한 단계 진행한다 (관리자/풀필먼트).
     *
     * @throws BusinessException ORDER_NOT_FOUND, INVALID_ORDER_STATUS_TRANSITION
     */
    @Transactional
    public OrderResponse advanceStatus(Long orderId, OrderStatus next, String reason) {
        Order order = orderRepository.findByIdOrThrow(orderId);

        OrderStatus previous = order.advanceTo(next);
        orderRepository.save(order);

        eventPublisher.publishEvent(OrderStatusChangedEvent.of(order, previous, reason));
        log.info("주문 상태 변경: orderId={}, {} → {}", orderId, previous, next);

        return OrderResponse.from(order);
    }

    /**
     * 주문 취소 (PENDING, CONFIRMED, PROCESSING에서만 가능)
     * 주문 항목 수량만큼 재고를 복원한다.
     *
     * @throws BusinessException ORDER_NOT_FOUND (없거나 본인 주문이 아님), ORDER_NOT_CANCELLABLE
     */
    @Transactional
    public OrderResponse cancel(Long userId, Long orderId, String reason) {
        Order order = findOwnedOrder(userId, orderId);

        OrderStatus previous = order.cancel(reason);
        for (OrderItem item : order.getOrderItems()) {
            inventoryService.release(item.getProductId(), item.getQuantity());
        }
        orderRepository.save(order);

        if (order.isPaid()) {
            log.warn("결제 완료 주문 취소: orderId={}. 환불은 별도로 요청해야 합니다", orderId);
        }

        eventPublisher.publishEvent(OrderStatusChangedEvent.of(order, previous, reason));
        log.info("주문 취소: orderId={}, userId={}, previousStatus={}, reason={}", orderId, userId, previous, reason);

        return OrderResponse.from(order);
    }

    private Order findOwnedOrder(Long userId, Long orderId) {
        Order order = orderRepository.findByIdOrThrow(orderId);
        if (!order.isOwnedBy(userId)) {
            throw new BusinessException(
                ErrorCode.ORDER_NOT_FOUND,
                "주문을 찾을 수 없습니다. orderId: " + orderId
            );
        }
        return order;
    }

    private void validatePage(int page, int size) {
        if (page < 0 || size <= 0 || size > MAX_PAGE_SIZE) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("페이지 파라미터가 올바르지 않습니다. page=%d, size=%d (size는 1~%d)", page, size, MAX_PAGE_SIZE)
            );
        }
    }
}
