package io.hhplus.checkout.infrastructure.external;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.RefundReason;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 타임아웃이 적용된 결제 대행사 호출
 *
 * 모든 대행사 호출은 전용 스레드 풀(gatewayExecutor)에서 실행되고 timeout 안에 끝나야 한다.
 *
 * 결과 매핑:
 * - 정상 응답: 그대로 반환
 * - BusinessException: 그대로 전파 (대행사 구현이 이미 분류한 오류)
 * - 그 외 예외: GATEWAY_ERROR
 * - 실행기 포화 (RejectedExecutionException): GATEWAY_ERROR (호출 전 거절, 재시도 가능)
 * - 타임아웃: GATEWAY_TIMEOUT (결과 불명)
 *   대행사에서는 처리됐을 수 있으므로 호출 측은 상태 재조회 후 재시도해야 한다
 */
@Slf4j
@Component
public class PaymentGatewayClient {

    private final PaymentGateway paymentGateway;
    private final Executor gatewayExecutor;
    private final MetricsCollector metricsCollector;
    private final Duration timeout;

    public PaymentGatewayClient(PaymentGateway paymentGateway,
                                @Qualifier("gatewayExecutor") Executor gatewayExecutor,
                                MetricsCollector metricsCollector,
                                @Value("${checkout.payment.gateway.timeout-ms:5000}") long timeoutMs) {
        this.paymentGateway = paymentGateway;
        this.gatewayExecutor = gatewayExecutor;
        this.metricsCollector = metricsCollector;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    public GatewayIntent createIntent(BigDecimal amount, Currency currency, Map<String, String> metadata) {
        return call("create_intent", () -> paymentGateway.createIntent(amount, currency, metadata));
    }

    public GatewayIntent confirmIntent(String gatewayIntentId, String paymentMethodId) {
        return call("confirm_intent", () -> paymentGateway.confirmIntent(gatewayIntentId, paymentMethodId));
    }

    public GatewayIntent retrieveIntent(String gatewayIntentId) {
        return call("retrieve_intent", () -> paymentGateway.retrieveIntent(gatewayIntentId));
    }

    public GatewayRefund createRefund(String gatewayIntentId, BigDecimal amount, RefundReason reason,
                                      Map<String, String> metadata) {
        return call("create_refund", () -> paymentGateway.createRefund(gatewayIntentId, amount, reason, metadata));
    }

    private <T> T call(String operation, Supplier<T> gatewayCall) {
        long startTime = System.currentTimeMillis();
        CompletableFuture<T> future = null;

        try {
            future = CompletableFuture.supplyAsync(gatewayCall, gatewayExecutor);
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // 호출 전에 거절되었으므로 대행사 측 결과는 없다 (재시도 가능)
            metricsCollector.recordGatewayRejected(operation);
            log.error("Payment gateway call rejected: operation={}, executor saturated", operation);
            throw new BusinessException(ErrorCode.GATEWAY_ERROR, "결제 대행사 호출 대기열이 가득 찼습니다: " + operation, e);
        } catch (TimeoutException e) {
            future.cancel(true);
            metricsCollector.recordGatewayTimeout(operation);
            log.error("Payment gateway timeout: operation={}, timeout={}ms. Outcome unknown, re-query before retry",
                operation, timeout.toMillis());
            throw new BusinessException(ErrorCode.GATEWAY_TIMEOUT, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BusinessException) {
                BusinessException businessException = (BusinessException) cause;
                log.warn("Payment gateway rejected: operation={}, code={}, message={}",
                    operation, businessException.getCode(), businessException.getMessage());
                throw businessException;
            }
            log.error("Payment gateway call failed: operation={}", operation, cause);
            throw new BusinessException(ErrorCode.GATEWAY_ERROR, "결제 대행사 호출에 실패했습니다: " + operation, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            throw new BusinessException(ErrorCode.GATEWAY_ERROR, e);
        } finally {
            metricsCollector.recordGatewayCall(operation, startTime);
        }
    }
}
