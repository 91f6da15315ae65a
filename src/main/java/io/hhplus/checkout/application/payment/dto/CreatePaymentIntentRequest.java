package io.hhplus.checkout.application.payment.dto;

import io.hhplus.checkout.domain.payment.Currency;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.Map;

/**
 * amount가 없으면 주문 총액, currency가 없으면 기본 통화를 사용한다.
 */
public record CreatePaymentIntentRequest(
    @NotNull(message = "주문 ID는 필수입니다")
    @Positive(message = "주문 ID는 양수여야 합니다")
    Long orderId,

    @Positive(message = "결제 금액은 0보다 커야 합니다")
    @Digits(integer = 10, fraction = 2, message = "결제 금액은 소수점 2자리까지 가능합니다")
    BigDecimal amount,

    Currency currency,

    Map<String, String> metadata
) {}
