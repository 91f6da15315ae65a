package io.hhplus.checkout.application.payment.dto;

import jakarta.validation.constraints.NotBlank;

public record ConfirmPaymentRequest(
    @NotBlank(message = "결제수단 토큰은 필수입니다")
    String paymentMethodId
) {}
