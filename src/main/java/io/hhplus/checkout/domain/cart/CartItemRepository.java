package io.hhplus.checkout.domain.cart;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface CartItemRepository {

    Optional<CartItem> findById(Long id);

    List<CartItem> findByCartId(Long cartId);

    Optional<CartItem> findByCartIdAndProductId(Long cartId, Long productId);

    CartItem save(CartItem cartItem);

    void deleteById(Long id);

    int deleteAllByCartId(Long cartId);

    default CartItem findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CART_ITEM_NOT_FOUND,
                "장바구니 아이템을 찾을 수 없습니다. cartItemId: " + id
            ));
    }
}
