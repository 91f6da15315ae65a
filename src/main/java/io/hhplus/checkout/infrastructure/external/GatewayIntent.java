package io.hhplus.checkout.infrastructure.external;

import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;

import java.math.BigDecimal;

/**
 * 대행사 intent 응답
 *
 * @param id             대행사 intent ID (예: "pi_3N...")
 * @param clientSecret   클라이언트 결제 화면에서 사용하는 값
 * @param status         로컬 상태로 변환된 대행사 상태
 * @param failureMessage 실패 사유 (실패 시에만)
 */
public record GatewayIntent(
    String id,
    String clientSecret,
    BigDecimal amount,
    Currency currency,
    PaymentIntentStatus status,
    String failureMessage
) {}
