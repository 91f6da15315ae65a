package io.hhplus.checkout.infrastructure.persistence.order;

import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderItem;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.PaymentStatus;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InMemory Order Repository
 *
 * 단위 테스트와 inmemory 프로필에서 사용한다.
 * createdAt(JPA Auditing)이 채워지지 않으므로 최신순 정렬은 id 역순으로 대신한다.
 */
@Repository
@Profile("inmemory")
public class InMemoryOrderRepository implements OrderRepository {

    private final Map<Long, Order> storage = new ConcurrentHashMap<>();
    private final Map<String, Order> orderNumberIndex = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);
    private final AtomicLong itemIdGenerator = new AtomicLong(1);

    @Override
    public Optional<Order> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public Optional<Order> findByOrderNumber(String orderNumber) {
        return Optional.ofNullable(orderNumberIndex.get(orderNumber));
    }

    @Override
    public Page<Order> findByUserIdAndStatus(Long userId, OrderStatus status, Pageable pageable) {
        List<Order> filtered = storage.values().stream()
            .filter(order -> order.isOwnedBy(userId))
            .filter(order -> status == null || order.getStatus() == status)
            .sorted(Comparator.comparing(Order::getId).reversed())
            .toList();

        return page(filtered, pageable);
    }

    @Override
    public Page<Order> search(OrderStatus status, PaymentStatus paymentStatus, Long userId, Pageable pageable) {
        List<Order> filtered = storage.values().stream()
            .filter(order -> status == null || order.getStatus() == status)
            .filter(order -> paymentStatus == null || order.getPaymentStatus() == paymentStatus)
            .filter(order -> userId == null || order.isOwnedBy(userId))
            .sorted(Comparator.comparing(Order::getId).reversed())
            .toList();

        return page(filtered, pageable);
    }

    private Page<Order> page(List<Order> filtered, Pageable pageable) {
        int from = (int) Math.min(pageable.getOffset(), filtered.size());
        int to = Math.min(from + pageable.getPageSize(), filtered.size());
        return new PageImpl<>(filtered.subList(from, to), pageable, filtered.size());
    }

    @Override
    public Order save(Order order) {
        if (order.getId() == null) {
            assignId(Order.class, order, idGenerator.getAndIncrement());
            for (OrderItem item : order.getOrderItems()) {
                if (item.getId() == null) {
                    assignId(OrderItem.class, item, itemIdGenerator.getAndIncrement());
                }
            }
        }

        storage.put(order.getId(), order);
        orderNumberIndex.put(order.getOrderNumber(), order);
        return order;
    }

    private void assignId(Class<?> type, Object target, Long newId) {
        try {
            var idField = type.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(target, newId);
        } catch (Exception e) {
            throw new RuntimeException("Failed to set ID", e);
        }
    }

    public void clear() {
        storage.clear();
        orderNumberIndex.clear();
        idGenerator.set(1);
        itemIdGenerator.set(1);
    }
}
