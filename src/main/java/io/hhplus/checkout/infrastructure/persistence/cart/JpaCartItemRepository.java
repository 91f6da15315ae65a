package io.hhplus.checkout.infrastructure.persistence.cart;

import io.hhplus.checkout.domain.cart.CartItem;
import io.hhplus.checkout.domain.cart.CartItemRepository;
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
public interface JpaCartItemRepository extends JpaRepository<CartItem, Long>, CartItemRepository {

    // Explicitly declare methods to resolve ambiguity with CartItemRepository
    @Override
    Optional<CartItem> findById(Long id);

    @Override
    CartItem save(CartItem cartItem);

    @Override
    void deleteById(Long id);

    @Override
    @Query("SELECT c FROM CartItem c WHERE c.cartId = :cartId ORDER BY c.id ASC")
    List<CartItem> findByCartId(@Param("cartId") Long cartId);

    @Override
    Optional<CartItem> findByCartIdAndProductId(Long cartId, Long productId);

    @Override
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM CartItem c WHERE c.cartId = :cartId")
    int deleteAllByCartId(@Param("cartId") Long cartId);
}
