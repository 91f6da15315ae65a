package io.hhplus.checkout.domain.order;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 주문 항목
 *
 * 단가(unitPrice)와 상품명은 주문 시점의 스냅샷이며 이후 Product가 바뀌어도 변하지 않는다.
 * 생성 후 변경 메서드를 제공하지 않는다.
 */
@Entity
@Table(
    name = "order_items",
    indexes = {
        @Index(name = "idx_order_id", columnList = "order_id"),
        @Index(name = "idx_product_id", columnList = "product_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false, updatable = false, foreignKey = @ForeignKey(name = "fk_order_item_order"))
    private Order order;

    @Column(name = "product_id", nullable = false, updatable = false)
    private Long productId;

    @Column(name = "product_name", nullable = false, length = 200, updatable = false)
    private String productName;

    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal subtotal;

    public static OrderItem create(Order order, Long productId, String productName, Integer quantity, BigDecimal unitPrice) {
        validateOrder(order);
        validateProductId(productId);
        validateQuantity(quantity);
        validateUnitPrice(unitPrice);

        OrderItem orderItem = new OrderItem();
        orderItem.order = order;
        orderItem.productId = productId;
        orderItem.productName = productName;
        orderItem.quantity = quantity;
        orderItem.unitPrice = unitPrice.setScale(2, RoundingMode.HALF_UP);
        orderItem.subtotal = orderItem.unitPrice.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);

        order.addOrderItem(orderItem);
        return orderItem;
    }

    public Long getOrderId() {
        return order != null ? order.getId() : null;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateOrder(Order order) {
        if (order == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문은 필수입니다");
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
    }

    private static void validateUnitPrice(BigDecimal unitPrice) {
        if (unitPrice == null || unitPrice.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품 가격은 0보다 커야 합니다");
        }
    }
}
