package io.hhplus.checkout.domain.cart;

import java.util.Optional;

/**
 * 장바구니 저장소. 사용자당 하나 (uk_cart_user)
 */
public interface CartRepository {

    Optional<Cart> findByUserId(Long userId);

    Cart save(Cart cart);

    /**
     * 첫 담기 시점에 장바구니를 만든다.
     * 호출 측은 CartLockManager로 사용자별 직렬화를 보장해야 한다.
     */
    default Cart findOrCreateByUserId(Long userId) {
        return findByUserId(userId)
            .orElseGet(() -> save(Cart.create(userId)));
    }
}
