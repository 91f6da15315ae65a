package io.hhplus.checkout.domain.cart;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * CartItem Entity
 *
 * 수량 불변식: 1 <= quantity <= MAX_QUANTITY
 * 수량 0은 저장하지 않고 삭제로 처리한다 (CartService.updateItem).
 *
 * priceSnapshot은 담은 시점의 가격으로 표시용이다.
 * 주문 금액은 체크아웃 시 Product 가격을 다시 읽어 계산한다.
 */
@Entity
@Table(
    name = "cart_items",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_cart_product", columnNames = {"cart_id", "product_id"})
    },
    indexes = {
        @Index(name = "idx_cart_id", columnList = "cart_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CartItem extends BaseTimeEntity {

    public static final int MAX_QUANTITY = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cart_id", nullable = false)
    private Long cartId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(nullable = false)
    private Integer quantity;

    @Column(name = "price_snapshot", nullable = false, precision = 12, scale = 2)
    private BigDecimal priceSnapshot;

    public static CartItem create(Cart cart, Long productId, Integer quantity, BigDecimal priceSnapshot) {
        validateCart(cart);
        validateProductId(productId);
        validateQuantity(quantity);

        CartItem cartItem = new CartItem();
        cartItem.cartId = cart.getId();
        cartItem.productId = productId;
        cartItem.quantity = quantity;
        cartItem.priceSnapshot = priceSnapshot;
        return cartItem;
    }

    public void updateQuantity(Integer quantity) {
        validateQuantity(quantity);
        this.quantity = quantity;
    }

    public void increaseQuantity(Integer additionalQuantity, BigDecimal currentPrice) {
        validateQuantity(this.quantity + additionalQuantity);
        this.quantity += additionalQuantity;
        this.priceSnapshot = currentPrice;
    }

    public boolean belongsTo(Long cartId) {
        return this.cartId.equals(cartId);
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateCart(Cart cart) {
        if (cart == null || cart.getId() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "장바구니는 필수입니다");
        }
    }

    private static void validateProductId(Long productId) {
        if (productId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품은 필수입니다");
        }
    }

    private static void validateQuantity(Integer quantity) {
        if (quantity == null || quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
        if (quantity > MAX_QUANTITY) {
            throw new BusinessException(
                ErrorCode.CART_ITEM_QUANTITY_EXCEEDED,
                String.format("상품당 최대 %d개까지 담을 수 있습니다. 요청 수량: %d", MAX_QUANTITY, quantity)
            );
        }
    }
}
