package io.hhplus.checkout.domain.cart;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Cart Entity (장바구니 집합 루트)
 *
 * 1. 사용자당 하나 (user_id UNIQUE), 첫 담기 시점에 생성
 * 2. 삭제하지 않는다. 주문 완료 후에는 아이템만 비워진다
 * 3. CartItem은 cart_id로 간접 참조 (아이템 단위 갱신이 잦아 집합 로딩을 피함)
 */
@Entity
@Table(
    name = "carts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_cart_user", columnNames = "user_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Cart extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    public static Cart create(Long userId) {
        validateUserId(userId);

        Cart cart = new Cart();
        cart.userId = userId;
        return cart;
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    private static void validateUserId(Long userId) {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "사용자 ID는 필수입니다");
        }
    }
}
