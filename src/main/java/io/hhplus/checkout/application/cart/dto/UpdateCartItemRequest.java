package io.hhplus.checkout.application.cart.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * 수량 0은 삭제로 처리된다.
 */
public record UpdateCartItemRequest(
    @NotNull(message = "수량은 필수입니다")
    @Min(value = 0, message = "수량은 0 이상이어야 합니다")
    @Max(value = 100, message = "수량은 100개 이하여야 합니다")
    Integer quantity
) {}
