package io.hhplus.checkout.application.cart;

import io.hhplus.checkout.application.cart.dto.CartItemIssue;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 체크아웃 검증 실패 (실패한 아이템 전체를 담는다)
 *
 * 판매 중지/삭제된 상품이 하나라도 있으면 PRODUCT_UNAVAILABLE, 재고 부족만 있으면 INSUFFICIENT_STOCK.
 */
@Getter
public class CartValidationException extends BusinessException {

    private final List<CartItemIssue> issues;

    private CartValidationException(ErrorCode errorCode, String message, List<CartItemIssue> issues) {
        super(errorCode, message);
        this.issues = List.copyOf(issues);
    }

    public static CartValidationException emptyCart() {
        return new CartValidationException(ErrorCode.CART_EMPTY, ErrorCode.CART_EMPTY.getMessage(), List.of());
    }

    public static CartValidationException of(List<CartItemIssue> issues) {
        ErrorCode errorCode = issues.stream().anyMatch(CartItemIssue::isUnavailable)
            ? ErrorCode.PRODUCT_UNAVAILABLE
            : ErrorCode.INSUFFICIENT_STOCK;

        String message = "장바구니 검증 실패: " + issues.stream()
            .map(CartItemIssue::describe)
            .collect(Collectors.joining(", "));

        return new CartValidationException(errorCode, message, issues);
    }
}
