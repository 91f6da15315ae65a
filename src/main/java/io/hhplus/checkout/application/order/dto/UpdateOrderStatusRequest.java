package io.hhplus.checkout.application.order.dto;

import io.hhplus.checkout.domain.order.OrderStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateOrderStatusRequest(
    @NotNull(message = "변경할 상태는 필수입니다")
    OrderStatus status,

    @Size(max = 500, message = "사유는 500자 이하여야 합니다")
    String reason
) {}
