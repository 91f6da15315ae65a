package io.hhplus.checkout.application.payment.dto;

import io.hhplus.checkout.domain.payment.RefundReason;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * amount가 없으면 남은 환불 가능 금액 전체를 환불한다.
 */
public record RefundRequest(
    @Positive(message = "환불 금액은 0보다 커야 합니다")
    @Digits(integer = 10, fraction = 2, message = "환불 금액은 소수점 2자리까지 가능합니다")
    BigDecimal amount,

    RefundReason reason
) {}
