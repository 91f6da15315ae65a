package io.hhplus.checkout.application.cart;

import io.hhplus.checkout.application.cart.dto.AddCartItemRequest;
import io.hhplus.checkout.application.cart.dto.CartItemIssue;
import io.hhplus.checkout.application.cart.dto.CartItemResponse;
import io.hhplus.checkout.application.cart.dto.CartItemUpdateResult;
import io.hhplus.checkout.application.cart.dto.CartResponse;
import io.hhplus.checkout.application.cart.dto.CartValidationResponse;
import io.hhplus.checkout.application.cart.dto.CheckoutItem;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.cart.Cart;
import io.hhplus.checkout.domain.cart.CartItem;
import io.hhplus.checkout.domain.cart.CartItemRepository;
import io.hhplus.checkout.domain.cart.CartRepository;
import io.hhplus.checkout.domain.product.Product;
import io.hhplus.checkout.domain.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 장바구니 서비스
 *
 * 재고를 읽기만 하고 변경하지 않는다. 재고 차감은 주문 생성(InventoryService)에서만 일어난다.
 * 사용자별 직렬화는 CartFacade / CreateOrderUseCase가 CartLockManager로 보장한다.
 *
 * 캐시: carts (key = userId), 모든 변경에서 무효화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartService {

    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    @Cacheable(value = "carts", key = "#userId")
    public CartResponse getCart(Long userId) {
        Cart cart = cartRepository.findByUserId(userId).orElse(null);
        if (cart == null) {
            return CartResponse.empty(userId);
        }

        List<CartItem> cartItems = cartItemRepository.findByCartId(cart.getId());
        Map<Long, Product> productById = loadProducts(cartItems);

        List<CartItemResponse> itemResponses = cartItems.stream()
            .filter(cartItem -> productById.containsKey(cartItem.getProductId()))
            .map(cartItem -> CartItemResponse.of(cartItem, productById.get(cartItem.getProductId())))
            .toList();

        return CartResponse.of(userId, itemResponses);
    }

    /**
     * 장바구니 담기
     * 이미 담긴 상품이면 수량을 합친다.
     */
    @Transactional
    @CacheEvict(value = "carts", key = "#userId")
    public CartResponse addItem(Long userId, AddCartItemRequest request) {
        // 1. 상품 검증 (존재, 판매 상태)
        Product product = productRepository.findByIdOrThrow(request.productId());
        if (!product.isActive()) {
            throw new BusinessException(
                ErrorCode.PRODUCT_UNAVAILABLE,
                "판매 중지된 상품입니다. productId: " + product.getId()
            );
        }

        // 2. 장바구니 조회 (없으면 생성)
        Cart cart = cartRepository.findOrCreateByUserId(userId);

        // 3. 기존 아이템이면 수량 합산, 없으면 신규 추가
        CartItem existingItem = cartItemRepository.findByCartIdAndProductId(cart.getId(), product.getId())
            .orElse(null);
        int resultingQuantity = existingItem != null
            ? existingItem.getQuantity() + request.quantity()
            : request.quantity();

        validateStock(product, resultingQuantity);

        if (existingItem != null) {
            existingItem.increaseQuantity(request.quantity(), product.getPrice());
            cartItemRepository.save(existingItem);
        } else {
            cartItemRepository.save(CartItem.create(cart, product.getId(), request.quantity(), product.getPrice()));
        }

        log.info("장바구니 담기: userId={}, productId={}, quantity={}, resultingQuantity={}",
            userId, product.getId(), request.quantity(), resultingQuantity);

        return getCart(userId);
    }

    /**
     * 수량 변경. 0이면 삭제하고 REMOVED를 반환한다.
     */
    @Transactional
    @CacheEvict(value = "carts", key = "#userId")
    public CartItemUpdateResult updateItem(Long userId, Long cartItemId, int quantity) {
        CartItem cartItem = findOwnedItem(userId, cartItemId);

        if (quantity == 0) {
            cartItemRepository.deleteById(cartItem.getId());
            log.info("장바구니 아이템 삭제 (수량 0): userId={}, cartItemId={}", userId, cartItemId);
            return CartItemUpdateResult.removed(cartItemId);
        }

        Product product = productRepository.findByIdOrThrow(cartItem.getProductId());
        validateStock(product, quantity);

        cartItem.updateQuantity(quantity);
        CartItem saved = cartItemRepository.save(cartItem);

        log.info("장바구니 수량 변경: userId={}, cartItemId={}, quantity={}", userId, cartItemId, quantity);
        return CartItemUpdateResult.updated(CartItemResponse.of(saved, product));
    }

    @Transactional
    @CacheEvict(value = "carts", key = "#userId")
    public void removeItem(Long userId, Long cartItemId) {
        CartItem cartItem = findOwnedItem(userId, cartItemId);
        cartItemRepository.deleteById(cartItem.getId());

        log.info("장바구니 아이템 삭제: userId={}, cartItemId={}", userId, cartItemId);
    }

    /**
     * 장바구니 비우기. 주문 생성 트랜잭션 안에서도 호출된다.
     *
     * @return 삭제된 아이템 수
     */
    @Transactional
    @CacheEvict(value = "carts", key = "#userId")
    public int clear(Long userId) {
        int deleted = cartRepository.findByUserId(userId)
            .map(cart -> cartItemRepository.deleteAllByCartId(cart.getId()))
            .orElse(0);

        log.info("장바구니 비우기: userId={}, deletedItems={}", userId, deleted);
        return deleted;
    }

    /**
     * 체크아웃 가능 여부 조회 (예외 없이 결과 반환)
     * 모든 아이템을 검사하고 실패 항목을 전부 모은다.
     */
    @Transactional(readOnly = true)
    public CartValidationResponse validate(Long userId) {
        List<CartItem> cartItems = cartRepository.findByUserId(userId)
            .map(cart -> cartItemRepository.findByCartId(cart.getId()))
            .orElse(List.of());

        if (cartItems.isEmpty()) {
            return CartValidationResponse.emptyCart();
        }

        Map<Long, Product> productById = loadProducts(cartItems);
        List<CheckoutItem> items = new ArrayList<>();
        List<CartItemIssue> issues = new ArrayList<>();

        for (CartItem cartItem : cartItems) {
            Product product = productById.get(cartItem.getProductId());

            if (product == null) {
                issues.add(new CartItemIssue(cartItem.getId(), cartItem.getProductId(), null,
                    cartItem.getQuantity(), 0, CartItemIssue.Reason.PRODUCT_NOT_FOUND));
            } else if (!product.isActive()) {
                issues.add(new CartItemIssue(cartItem.getId(), product.getId(), product.getName(),
                    cartItem.getQuantity(), product.getStock(), CartItemIssue.Reason.INACTIVE));
            } else if (!product.hasEnoughStock(cartItem.getQuantity())) {
                issues.add(new CartItemIssue(cartItem.getId(), product.getId(), product.getName(),
                    cartItem.getQuantity(), product.getStock(), CartItemIssue.Reason.INSUFFICIENT_STOCK));
            } else {
                items.add(new CheckoutItem(product.getId(), product.getName(), cartItem.getQuantity(), product.getPrice()));
            }
        }

        return CartValidationResponse.of(items, issues);
    }

    /**
     * 체크아웃 검증. 실패 시 CartValidationException (CART_EMPTY, PRODUCT_UNAVAILABLE, INSUFFICIENT_STOCK)
     *
     * @return 주문 대상 아이템 (현재 상품 가격)
     */
    @Transactional(readOnly = true)
    public List<CheckoutItem> validateForCheckout(Long userId) {
        CartValidationResponse validation = validate(userId);

        if (validation.empty()) {
            throw CartValidationException.emptyCart();
        }
        if (!validation.valid()) {
            log.warn("장바구니 검증 실패: userId={}, issues={}", userId, validation.issues().size());
            throw CartValidationException.of(validation.issues());
        }
        return validation.items();
    }

    // ====================================
    // Private Methods
    // ====================================

    private CartItem findOwnedItem(Long userId, Long cartItemId) {
        Cart cart = cartRepository.findByUserId(userId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CART_ITEM_NOT_FOUND,
                "장바구니 아이템을 찾을 수 없습니다. cartItemId: " + cartItemId
            ));

        CartItem cartItem = cartItemRepository.findByIdOrThrow(cartItemId);
        if (!cartItem.belongsTo(cart.getId())) {
            throw new BusinessException(
                ErrorCode.CART_ITEM_NOT_FOUND,
                "장바구니 아이템을 찾을 수 없습니다. cartItemId: " + cartItemId
            );
        }
        return cartItem;
    }

    private void validateStock(Product product, int quantity) {
        if (!product.hasEnoughStock(quantity)) {
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("재고가 부족합니다. 상품: %s (요청: %d개, 재고: %d개)",
                    product.getName(), quantity, product.getStock())
            );
        }
    }

    private Map<Long, Product> loadProducts(List<CartItem> cartItems) {
        List<Long> productIds = cartItems.stream()
            .map(CartItem::getProductId)
            .distinct()
            .toList();

        return productRepository.findAllById(productIds).stream()
            .collect(Collectors.toMap(Product::getId, Function.identity()));
    }
}
