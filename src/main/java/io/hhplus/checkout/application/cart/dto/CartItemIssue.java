package io.hhplus.checkout.application.cart.dto;

/**
 * 체크아웃 검증에 실패한 장바구니 아이템
 */
public record CartItemIssue(
    Long cartItemId,
    Long productId,
    String productName,
    int requestedQuantity,
    int availableStock,
    Reason reason
) {
    public enum Reason {
        PRODUCT_NOT_FOUND,
        INACTIVE,
        INSUFFICIENT_STOCK
    }

    public boolean isUnavailable() {
        return reason == Reason.PRODUCT_NOT_FOUND || reason == Reason.INACTIVE;
    }

    public String describe() {
        return switch (reason) {
            case PRODUCT_NOT_FOUND -> String.format("상품을 찾을 수 없습니다 (productId: %d)", productId);
            case INACTIVE -> String.format("\"%s\" 상품은 판매 중지되었습니다", productName);
            case INSUFFICIENT_STOCK -> String.format("\"%s\" 재고 부족. 재고: %d, 요청: %d",
                productName, availableStock, requestedQuantity);
        };
    }
}
