package io.hhplus.checkout.domain.product;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Product Entity
 *
 * 체크아웃 코어 입장에서는 읽기 전용이다.
 * 재고(stock)는 InventoryService를 통해서만 변경된다.
 *
 * - price: 소수점 2자리 (BigDecimal)
 * - active=false: 판매 중지 (장바구니 담기/주문 불가)
 * - version: 엔티티 단위 수정 시 낙관적 락
 */
@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false)
    private Integer stock;

    @Column(nullable = false)
    private boolean active;

    @Version
    private Long version;

    public static Product create(String name, BigDecimal price, Integer stock) {
        validateName(name);
        validatePrice(price);
        validateStock(stock);

        Product product = new Product();
        product.name = name;
        product.price = price.setScale(2, RoundingMode.HALF_UP);
        product.stock = stock;
        product.active = true;
        return product;
    }

    public void decreaseStock(int quantity) {
        validateQuantity(quantity);
        validateSufficientStock(quantity);

        this.stock -= quantity;
    }

    public void increaseStock(int quantity) {
        validateQuantity(quantity);

        this.stock += quantity;
    }

    public boolean hasEnoughStock(int quantity) {
        return this.stock >= quantity;
    }

    /**
     * 판매가 변경. 이미 생성된 주문 항목의 단가(스냅샷)에는 영향이 없다.
     */
    public void changePrice(BigDecimal newPrice) {
        validatePrice(newPrice);

        this.price = newPrice.setScale(2, RoundingMode.HALF_UP);
    }

    public void deactivate() {
        this.active = false;
    }

    public void activate() {
        this.active = true;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품명은 필수입니다");
        }
    }

    private void validateQuantity(int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
    }

    private void validateSufficientStock(int quantity) {
        if (this.stock < quantity) {
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("재고 부족: 현재 재고 %d, 요청 수량 %d", this.stock, quantity)
            );
        }
    }

    private static void validatePrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "가격은 0보다 커야 합니다");
        }
    }

    private static void validateStock(Integer stock) {
        if (stock == null || stock < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "재고는 0 이상이어야 합니다");
        }
    }
}
