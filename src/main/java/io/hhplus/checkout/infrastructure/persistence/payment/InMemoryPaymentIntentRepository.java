package io.hhplus.checkout.infrastructure.persistence.payment;

import io.hhplus.checkout.domain.payment.PaymentIntent;
import io.hhplus.checkout.domain.payment.PaymentIntentRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InMemory PaymentIntent Repository
 *
 * order_id UNIQUE 제약을 흉내 낸다: 같은 주문에 두 번째 intent를 저장하면
 * DataIntegrityViolationException을 던진다 (JPA 구현과 동일한 계약).
 */
@Repository
@Profile("inmemory")
public class InMemoryPaymentIntentRepository implements PaymentIntentRepository {

    private final Map<Long, PaymentIntent> storage = new ConcurrentHashMap<>();
    private final Map<Long, Long> orderIndex = new ConcurrentHashMap<>();
    private final Map<String, Long> gatewayIdIndex = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<PaymentIntent> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public Optional<PaymentIntent> findByOrderId(Long orderId) {
        return Optional.ofNullable(orderIndex.get(orderId)).map(storage::get);
    }

    @Override
    public Optional<PaymentIntent> findByGatewayIntentId(String gatewayIntentId) {
        return Optional.ofNullable(gatewayIdIndex.get(gatewayIntentId)).map(storage::get);
    }

    @Override
    public synchronized PaymentIntent save(PaymentIntent paymentIntent) {
        if (paymentIntent.getId() == null) {
            if (orderIndex.containsKey(paymentIntent.getOrderId())) {
                throw new DataIntegrityViolationException(
                    "Duplicate entry for uk_payment_intent_order: " + paymentIntent.getOrderId());
            }
            Long newId = idGenerator.getAndIncrement();
            try {
                var idField = PaymentIntent.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(paymentIntent, newId);
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }

        storage.put(paymentIntent.getId(), paymentIntent);
        orderIndex.put(paymentIntent.getOrderId(), paymentIntent.getId());
        gatewayIdIndex.put(paymentIntent.getGatewayIntentId(), paymentIntent.getId());
        return paymentIntent;
    }

    public void clear() {
        storage.clear();
        orderIndex.clear();
        gatewayIdIndex.clear();
        idGenerator.set(1);
    }
}
