package io.hhplus.checkout.infrastructure.persistence.cart;

import io.hhplus.checkout.domain.cart.Cart;
import io.hhplus.checkout.domain.cart.CartRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public interface JpaCartRepository extends JpaRepository<Cart, Long>, CartRepository {

    // uk_cart_user 인덱스 조회
    @Override
    @Query("SELECT c FROM Cart c WHERE c.userId = :userId")
    Optional<Cart> findByUserId(@Param("userId") Long userId);

    @Override
    Cart save(Cart cart);
}
