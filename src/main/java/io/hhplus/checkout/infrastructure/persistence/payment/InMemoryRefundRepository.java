package io.hhplus.checkout.infrastructure.persistence.payment;

import io.hhplus.checkout.domain.payment.Refund;
import io.hhplus.checkout.domain.payment.RefundRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryRefundRepository implements RefundRepository {

    private final Map<Long, Refund> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Refund save(Refund refund) {
        if (refund.getId() == null) {
            Long newId = idGenerator.getAndIncrement();
            try {
                var idField = Refund.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(refund, newId);
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }
        storage.put(refund.getId(), refund);
        return refund;
    }

    @Override
    public List<Refund> findByOrderId(Long orderId) {
        return storage.values().stream()
            .filter(refund -> refund.getOrderId().equals(orderId))
            .sorted(Comparator.comparing(Refund::getId))
            .toList();
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
