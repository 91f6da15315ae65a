package io.hhplus.checkout.application.usecase.order;

import io.hhplus.checkout.application.cart.CartLockManager;
import io.hhplus.checkout.application.cart.CartService;
import io.hhplus.checkout.application.cart.dto.CheckoutItem;
import io.hhplus.checkout.application.inventory.InventoryService;
import io.hhplus.checkout.application.order.dto.CreateOrderRequest;
import io.hhplus.checkout.application.order.dto.OrderResponse;
import io.hhplus.checkout.application.usecase.UseCase;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 주문 생성 UseCase
 * <p>
 * 동시성 제어:
 * - 사용자별 로컬 락 (CartLockManager): 같은 사용자의 주문 생성/장바구니 변경 직렬화
 *   두 번째 제출은 비워진 장바구니를 보고 CART_EMPTY로 실패한다
 * - 재고: 상품별 조건부 원자적 UPDATE (InventoryService)
 * <p>
 * 데드락 방지:
 * - 여러 상품 주문 시 상품 ID 오름차순으로 예약
 * <p>
 * 보상 트랜잭션 흐름:
 * <pre>
 * 정상 흐름:
 * 장바구니 검증 → 재고 예약 (상품별 커밋) → 주문 저장 + 장바구니 비우기 (트랜잭션)
 *
 * 실패 시나리오 1: N번째 상품 재고 부족
 * 1..N-1 예약 (✅ 완료) → N 예약 (❌ 실패)
 * → 보상: 1..N-1 해제
 *
 * 실패 시나리오 2: 주문 저장 실패
 * 전체 예약 (✅ 완료) → 주문 저장 (❌ 롤백)
 * → 보상: 전체 해제
 * </pre>
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateOrderUseCase {

    private final CartLockManager cartLockManager;
    private final CartService cartService;
    private final InventoryService inventoryService;
    private final OrderTransactionService orderTransactionService;
    private final MetricsCollector metricsCollector;

    public OrderResponse execute(Long userId, CreateOrderRequest request) {
        return cartLockManager.withLock(userId, () -> createOrder(userId, request));
    }

    private OrderResponse createOrder(Long userId, CreateOrderRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Creating order for user: {}, paymentMethod: {}", userId, request.paymentMethod());

        List<CheckoutItem> reserved = new ArrayList<>();
        try {
            // 1. 장바구니 재검증 (비어 있음, 판매 중지, 재고 부족)
            List<CheckoutItem> items = cartService.validateForCheckout(userId).stream()
                .sorted(Comparator.comparing(CheckoutItem::productId))
                .toList();

            // 2. 재고 예약 (상품 ID 오름차순)
            for (CheckoutItem item : items) {
                inventoryService.reserve(item.productId(), item.quantity());
                reserved.add(item);
            }

            // 3. 주문 저장 + 장바구니 비우기 (트랜잭션)
            OrderResponse response = orderTransactionService.persistOrder(userId, request, items);

            metricsCollector.recordOrderSuccess();
            metricsCollector.recordOrderDuration(startTime);
            log.info("Order created successfully. orderId: {}, orderNumber: {}",
                response.orderId(), response.orderNumber());
            return response;

        } catch (RuntimeException e) {
            log.warn("Order creation failed for user: {}, reservedItems: {}, error: {}",
                userId, reserved.size(), e.getMessage());
            releaseReservations(userId, reserved);
            metricsCollector.recordOrderFailure();
            throw e;
        }
    }

    /**
     * 예약 보상. 해제 실패는 전파하지 않고 수동 조치 대상으로 남긴다.
     */
    private void releaseReservations(Long userId, List<CheckoutItem> reserved) {
        for (CheckoutItem item : reserved) {
            try {
                inventoryService.release(item.productId(), item.quantity());
            } catch (Exception releaseError) {
                log.error("Stock release failed. userId: {}, productId: {}, quantity: {}. Manual intervention required!",
                    userId, item.productId(), item.quantity(), releaseError);
            }
        }
    }
}
