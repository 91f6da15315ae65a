package io.hhplus.checkout.infrastructure.persistence.cart;

import io.hhplus.checkout.domain.cart.Cart;
import io.hhplus.checkout.domain.cart.CartRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryCartRepository implements CartRepository {

    private final Map<Long, Cart> storageByUserId = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        return Optional.ofNullable(storageByUserId.get(userId));
    }

    @Override
    public Cart save(Cart cart) {
        if (cart.getId() == null) {
            Long newId = idGenerator.getAndIncrement();
            try {
                var idField = Cart.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(cart, newId);
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }

        storageByUserId.put(cart.getUserId(), cart);
        return cart;
    }

    public void clear() {
        storageByUserId.clear();
        idGenerator.set(1);
    }
}
