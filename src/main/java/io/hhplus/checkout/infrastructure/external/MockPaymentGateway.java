package io.hhplus.checkout.infrastructure.external;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;
import io.hhplus.checkout.domain.payment.RefundReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mock 결제 대행사 구현
 * <p>
 * 실제 외부 API가 없는 환경에서 대행사 동작을 시뮬레이션한다.
 * <p>
 * 시뮬레이션 규칙 (paymentMethodId 기준):
 * - "fail" 포함: 승인 거절 (status=FAILED, card_declined)
 * - "slow" 포함: 응답 지연 (타임아웃 검증용)
 * - "error" 포함: 대행사 오류 (GATEWAY_ERROR)
 * - 그 외: 승인 성공
 * <p>
 * 참고: @Profile("!prod")로 운영 환경에서는 비활성화
 */
@Slf4j
@Service
@Profile("!prod")
public class MockPaymentGateway implements PaymentGateway {

    private static final long SLOW_RESPONSE_MILLIS = 10_000L;

    private final Map<String, GatewayIntent> intents = new ConcurrentHashMap<>();

    @Override
    public GatewayIntent createIntent(BigDecimal amount, Currency currency, Map<String, String> metadata) {
        String intentId = "pi_mock_" + randomSuffix();
        GatewayIntent intent = new GatewayIntent(
            intentId,
            intentId + "_secret_" + randomSuffix(),
            amount,
            currency,
            PaymentIntentStatus.REQUIRES_ACTION,
            null
        );
        intents.put(intentId, intent);

        log.info("Mock gateway: intent created - intentId={}, amount={}, currency={}, metadata={}",
            intentId, amount, currency.getCode(), metadata);
        return intent;
    }

    @Override
    public GatewayIntent confirmIntent(String gatewayIntentId, String paymentMethodId) {
        GatewayIntent current = findIntent(gatewayIntentId);
        String method = paymentMethodId.toLowerCase(Locale.ROOT);

        if (method.contains("slow")) {
            simulateDelay();
        }
        if (method.contains("error")) {
            log.warn("Mock gateway: simulating gateway error for paymentMethodId={}", paymentMethodId);
            throw new BusinessException(ErrorCode.GATEWAY_ERROR, "결제 대행사 오류 (Mock)");
        }

        GatewayIntent confirmed = method.contains("fail")
            ? withStatus(current, PaymentIntentStatus.FAILED, "card_declined")
            : withStatus(current, PaymentIntentStatus.SUCCEEDED, null);
        intents.put(gatewayIntentId, confirmed);

        log.info("Mock gateway: intent confirmed - intentId={}, status={}", gatewayIntentId, confirmed.status());
        return confirmed;
    }

    @Override
    public GatewayIntent retrieveIntent(String gatewayIntentId) {
        return findIntent(gatewayIntentId);
    }

    @Override
    public GatewayRefund createRefund(String gatewayIntentId, BigDecimal amount, RefundReason reason,
                                      Map<String, String> metadata) {
        GatewayIntent intent = findIntent(gatewayIntentId);
        if (intent.status() != PaymentIntentStatus.SUCCEEDED) {
            throw new BusinessException(
                ErrorCode.GATEWAY_ERROR,
                "승인되지 않은 결제는 환불할 수 없습니다 (Mock). intentId: " + gatewayIntentId
            );
        }

        String refundId = "re_mock_" + randomSuffix();
        log.info("Mock gateway: refund created - refundId={}, intentId={}, amount={}, reason={}",
            refundId, gatewayIntentId, amount, reason.getValue());
        return new GatewayRefund(refundId, amount, "succeeded");
    }

    private GatewayIntent findIntent(String gatewayIntentId) {
        GatewayIntent intent = intents.get(gatewayIntentId);
        if (intent == null) {
            throw new BusinessException(
                ErrorCode.GATEWAY_ERROR,
                "대행사에 존재하지 않는 intent입니다 (Mock). intentId: " + gatewayIntentId
            );
        }
        return intent;
    }

    private GatewayIntent withStatus(GatewayIntent intent, PaymentIntentStatus status, String failureMessage) {
        return new GatewayIntent(intent.id(), intent.clientSecret(), intent.amount(), intent.currency(), status, failureMessage);
    }

    private void simulateDelay() {
        try {
            Thread.sleep(SLOW_RESPONSE_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.GATEWAY_ERROR, e);
        }
    }

    private String randomSuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
