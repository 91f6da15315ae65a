package io.hhplus.checkout.infrastructure.persistence.product;

import io.hhplus.checkout.domain.product.Product;
import io.hhplus.checkout.domain.product.ProductRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaProductRepository extends JpaRepository<Product, Long>, ProductRepository {

    // Explicitly declare methods to resolve ambiguity with ProductRepository
    @Override
    Optional<Product> findById(Long id);

    @Override
    List<Product> findAllById(Iterable<Long> ids);

    @Override
    Product save(Product product);

    /**
     * 조건부 원자적 차감 (UPDATE ... WHERE stock >= :quantity)
     *
     * - 같은 상품 행에 대한 UPDATE는 DB 행 락으로 직렬화된다
     * - 조건을 만족하지 못하면 0 반환 → 재고 부족
     * - 조회 후 차감(read-modify-write)이 아니므로 음수 재고가 생기지 않는다
     */
    @Override
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock - :quantity, p.version = p.version + 1 " +
           "WHERE p.id = :productId AND p.stock >= :quantity")
    int decreaseStockIfAvailable(@Param("productId") Long productId, @Param("quantity") int quantity);

    /**
     * 재고 복원. 주문 취소 트랜잭션 안에서도 호출되므로 영속성 컨텍스트를 비우지 않는다.
     */
    @Override
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock + :quantity, p.version = p.version + 1 " +
           "WHERE p.id = :productId")
    int increaseStock(@Param("productId") Long productId, @Param("quantity") int quantity);

    @Override
    @Query("SELECT p.stock FROM Product p WHERE p.id = :productId")
    Optional<Integer> findStockById(@Param("productId") Long productId);
}
