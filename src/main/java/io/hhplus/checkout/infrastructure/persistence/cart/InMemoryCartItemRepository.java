package io.hhplus.checkout.infrastructure.persistence.cart;

import io.hhplus.checkout.domain.cart.CartItem;
import io.hhplus.checkout.domain.cart.CartItemRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryCartItemRepository implements CartItemRepository {

    private final Map<Long, CartItem> storage = new ConcurrentHashMap<>();
    private final Map<String, Long> cartProductIndex = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<CartItem> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<CartItem> findByCartId(Long cartId) {
        return storage.values().stream()
            .filter(item -> item.belongsTo(cartId))
            .sorted(Comparator.comparing(CartItem::getId))
            .toList();
    }

    @Override
    public Optional<CartItem> findByCartIdAndProductId(Long cartId, Long productId) {
        Long itemId = cartProductIndex.get(makeKey(cartId, productId));
        if (itemId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storage.get(itemId));
    }

    @Override
    public CartItem save(CartItem cartItem) {
        if (cartItem.getId() == null) {
            Long newId = idGenerator.getAndIncrement();
            try {
                var idField = CartItem.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(cartItem, newId);
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }

        storage.put(cartItem.getId(), cartItem);
        cartProductIndex.put(makeKey(cartItem.getCartId(), cartItem.getProductId()), cartItem.getId());
        return cartItem;
    }

    @Override
    public void deleteById(Long id) {
        CartItem cartItem = storage.remove(id);
        if (cartItem != null) {
            cartProductIndex.remove(makeKey(cartItem.getCartId(), cartItem.getProductId()));
        }
    }

    @Override
    public int deleteAllByCartId(Long cartId) {
        List<CartItem> items = findByCartId(cartId);
        items.forEach(item -> deleteById(item.getId()));
        return items.size();
    }

    private String makeKey(Long cartId, Long productId) {
        return cartId + ":" + productId;
    }

    public void clear() {
        storage.clear();
        cartProductIndex.clear();
        idGenerator.set(1);
    }
}
