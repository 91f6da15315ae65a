package io.hhplus.checkout.infrastructure.persistence.product;

import io.hhplus.checkout.domain.product.Product;
import io.hhplus.checkout.domain.product.ProductRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InMemory Product Repository
 *
 * 재고 차감/증가는 ConcurrentHashMap.compute로 키(상품) 단위 원자성을 보장한다.
 * 서로 다른 상품은 서로를 막지 않는다.
 */
@Repository
@Profile("inmemory")
public class InMemoryProductRepository implements ProductRepository {

    private final Map<Long, Product> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<Product> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Product> findAllById(Iterable<Long> ids) {
        List<Product> result = new ArrayList<>();
        ids.forEach(id -> findById(id).ifPresent(result::add));
        return result;
    }

    @Override
    public Product save(Product product) {
        if (product.getId() == null) {
            Long newId = idGenerator.getAndIncrement();
            try {
                var idField = Product.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(product, newId);
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }

        storage.put(product.getId(), product);
        return product;
    }

    @Override
    public int decreaseStockIfAvailable(Long productId, int quantity) {
        AtomicInteger updated = new AtomicInteger();
        storage.computeIfPresent(productId, (id, product) -> {
            if (product.hasEnoughStock(quantity)) {
                product.decreaseStock(quantity);
                updated.set(1);
            }
            return product;
        });
        return updated.get();
    }

    @Override
    public int increaseStock(Long productId, int quantity) {
        AtomicInteger updated = new AtomicInteger();
        storage.computeIfPresent(productId, (id, product) -> {
            product.increaseStock(quantity);
            updated.set(1);
            return product;
        });
        return updated.get();
    }

    @Override
    public Optional<Integer> findStockById(Long productId) {
        AtomicInteger stock = new AtomicInteger(-1);
        storage.computeIfPresent(productId, (id, product) -> {
            stock.set(product.getStock());
            return product;
        });
        return stock.get() < 0 ? Optional.empty() : Optional.of(stock.get());
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
