package io.hhplus.checkout.infrastructure.external;

import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.RefundReason;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 결제 대행사(Payment Gateway) 인터페이스
 * <p>
 * 외부 결제 대행사 API 호출을 추상화한다. 대행사 자체 프로토콜은 구현체가 책임진다.
 * <p>
 * 현재 구현:
 * - MockPaymentGateway: Mock 구현 (실제 API 없음)
 * <p>
 * 호출 측은 PaymentGatewayClient를 통해 타임아웃이 걸린 상태로 호출해야 한다.
 */
public interface PaymentGateway {

    /**
     * 결제 요청(intent) 생성
     *
     * @param amount   결제 금액 (소수점 2자리)
     * @param currency 통화
     * @param metadata orderId, userId 등 대행사에 함께 저장할 값
     */
    GatewayIntent createIntent(BigDecimal amount, Currency currency, Map<String, String> metadata);

    /**
     * 결제 승인
     *
     * @param gatewayIntentId 대행사 intent ID
     * @param paymentMethodId 대행사 결제수단 토큰
     */
    GatewayIntent confirmIntent(String gatewayIntentId, String paymentMethodId);

    /**
     * 대행사의 현재 intent 상태 조회
     */
    GatewayIntent retrieveIntent(String gatewayIntentId);

    /**
     * 환불 요청
     */
    GatewayRefund createRefund(String gatewayIntentId, BigDecimal amount, RefundReason reason, Map<String, String> metadata);
}
