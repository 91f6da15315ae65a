package io.hhplus.checkout.application.order.dto;

import jakarta.validation.constraints.Size;

public record CancelOrderRequest(
    @Size(max = 500, message = "취소 사유는 500자 이하여야 합니다")
    String reason
) {}
