package io.hhplus.checkout.application.facade;

import io.hhplus.checkout.application.cart.CartLockManager;
import io.hhplus.checkout.application.cart.CartService;
import io.hhplus.checkout.application.cart.dto.AddCartItemRequest;
import io.hhplus.checkout.application.cart.dto.CartItemUpdateResult;
import io.hhplus.checkout.application.cart.dto.CartResponse;
import io.hhplus.checkout.application.cart.dto.CartValidationResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 장바구니 변경 Facade
 *
 * 변경 연산은 사용자별 락 안에서 트랜잭션을 시작한다 (락 → 트랜잭션 → 커밋 → 해제).
 * 주문 생성과 같은 락을 쓰므로 체크아웃 도중의 장바구니 변경이 주문에 섞이지 않는다.
 */
@Component
@RequiredArgsConstructor
public class CartFacade {

    private final CartLockManager cartLockManager;
    private final CartService cartService;

    public CartResponse getCart(Long userId) {
        return cartService.getCart(userId);
    }

    public CartResponse addItem(Long userId, AddCartItemRequest request) {
        return cartLockManager.withLock(userId, () -> cartService.addItem(userId, request));
    }

    public CartItemUpdateResult updateItem(Long userId, Long cartItemId, int quantity) {
        return cartLockManager.withLock(userId, () -> cartService.updateItem(userId, cartItemId, quantity));
    }

    public void removeItem(Long userId, Long cartItemId) {
        cartLockManager.withLock(userId, () -> cartService.removeItem(userId, cartItemId));
    }

    public int clear(Long userId) {
        return cartLockManager.withLock(userId, () -> cartService.clear(userId));
    }

    public CartValidationResponse validate(Long userId) {
        return cartService.validate(userId);
    }
}
