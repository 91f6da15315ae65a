package io.hhplus.checkout.application.usecase.order;

import io.hhplus.checkout.application.cart.CartService;
import io.hhplus.checkout.application.cart.dto.CheckoutItem;
import io.hhplus.checkout.application.order.dto.CreateOrderRequest;
import io.hhplus.checkout.application.order.dto.OrderResponse;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderCreatedEvent;
import io.hhplus.checkout.domain.order.OrderItem;
import io.hhplus.checkout.domain.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * 주문 생성의 트랜잭션 구간
 *
 * 재고 예약 이후 하나의 트랜잭션으로 실행된다:
 * 1. 주문/주문 항목 저장 (status=PENDING, paymentStatus=PENDING)
 * 2. 장바구니 비우기
 * 3. OrderCreatedEvent 발행 (리스너는 커밋 후 실행)
 *
 * 이 트랜잭션이 실패하면 예약된 재고는 CreateOrderUseCase가 해제한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderTransactionService {

    private final OrderRepository orderRepository;
    private final CartService cartService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public OrderResponse persistOrder(Long userId, CreateOrderRequest request, List<CheckoutItem> items) {
        Order order = Order.create(
            Order.generateOrderNumber(LocalDate.now()),
            userId,
            request.shippingAddress().toAddress(),
            request.billingAddressOrNull(),
            request.paymentMethod(),
            request.notes()
        );

        // 단가는 검증 시점의 상품 가격으로 고정
        for (CheckoutItem item : items) {
            OrderItem.create(order, item.productId(), item.productName(), item.quantity(), item.unitPrice());
        }

        Order savedOrder = orderRepository.save(order);
        cartService.clear(userId);

        eventPublisher.publishEvent(OrderCreatedEvent.from(savedOrder));

        log.info("주문 저장 완료: orderId={}, orderNumber={}, userId={}, totalAmount={}",
            savedOrder.getId(), savedOrder.getOrderNumber(), userId, savedOrder.getTotalAmount());

        return OrderResponse.from(savedOrder);
    }
}
