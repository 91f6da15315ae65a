package io.hhplus.checkout.infrastructure.external;

import java.math.BigDecimal;

/**
 * 대행사 환불 응답
 *
 * @param id     대행사 환불 ID (예: "re_3N...")
 * @param status 대행사 환불 상태 (succeeded, pending ...)
 */
public record GatewayRefund(
    String id,
    BigDecimal amount,
    String status
) {}
