package io.hhplus.checkout.domain.product;

/**
 * 재고 부족 임계치 도달 이벤트
 *
 * 차감 전 재고가 임계치 초과, 차감 후 재고가 임계치 이하일 때 한 번만 발행된다.
 */
public record InventoryLowEvent(
    Long productId,
    String productName,
    int remainingStock,
    int threshold
) {}
