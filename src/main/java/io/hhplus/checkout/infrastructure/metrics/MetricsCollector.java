package io.hhplus.checkout.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 체크아웃 주요 비즈니스 메트릭 수집
 *
 * 수집 메트릭:
 * - orders_total: 주문 생성 성공/실패 카운터
 * - order_duration_seconds: 주문 생성 처리 시간 (P50, P95, P99)
 * - stock_errors_total: 재고 부족 에러 카운터
 * - payment_total: 결제 확정 성공/실패 카운터
 * - refunds_total: 환불 (full/partial)
 * - payment_gateway_duration_seconds: 대행사 호출 시간 (operation 태그)
 * - payment_gateway_timeouts_total: 대행사 타임아웃 (operation 태그)
 * - webhook_events_total: 웹훅 처리 결과 (result 태그)
 */
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    // 주문 관련 메트릭
    private final Counter orderSuccessCounter;
    private final Counter orderFailureCounter;
    private final Timer orderDurationTimer;

    // 재고 관련 메트릭
    private final Counter stockErrorCounter;

    // 결제 관련 메트릭
    private final Counter paymentSuccessCounter;
    private final Counter paymentFailureCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.orderSuccessCounter = Counter.builder("orders_total")
                .tag("status", "success")
                .description("Total number of successful orders")
                .register(meterRegistry);

        this.orderFailureCounter = Counter.builder("orders_total")
                .tag("status", "failure")
                .description("Total number of failed orders")
                .register(meterRegistry);

        this.orderDurationTimer = Timer.builder("order_duration_seconds")
                .description("Order creation duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.stockErrorCounter = Counter.builder("stock_errors_total")
                .description("Total number of stock shortage errors")
                .register(meterRegistry);

        this.paymentSuccessCounter = Counter.builder("payment_total")
                .tag("status", "success")
                .description("Total number of settled payments")
                .register(meterRegistry);

        this.paymentFailureCounter = Counter.builder("payment_total")
                .tag("status", "failure")
                .description("Total number of failed payments")
                .register(meterRegistry);
    }

    // ============================================================
    // 주문 관련 메트릭
    // ============================================================

    public void recordOrderSuccess() {
        orderSuccessCounter.increment();
    }

    public void recordOrderFailure() {
        orderFailureCounter.increment();
    }

    public void recordOrderDuration(long startTimeMs) {
        long duration = System.currentTimeMillis() - startTimeMs;
        orderDurationTimer.record(duration, TimeUnit.MILLISECONDS);
    }

    // ============================================================
    // 재고 관련 메트릭
    // ============================================================

    public void recordStockError() {
        stockErrorCounter.increment();
    }

    // ============================================================
    // 결제 관련 메트릭
    // ============================================================

    public void recordPaymentSuccess() {
        paymentSuccessCounter.increment();
    }

    public void recordPaymentFailure() {
        paymentFailureCounter.increment();
    }

    public void recordRefund(boolean fullRefund) {
        Counter.builder("refunds_total")
                .tag("type", fullRefund ? "full" : "partial")
                .description("Total number of refunds")
                .register(meterRegistry)
                .increment();
    }

    public void recordGatewayCall(String operation, long startTimeMs) {
        long duration = System.currentTimeMillis() - startTimeMs;
        Timer.builder("payment_gateway_duration_seconds")
                .tag("operation", operation)
                .description("Payment gateway call duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration, TimeUnit.MILLISECONDS);
    }

    public void recordGatewayTimeout(String operation) {
        Counter.builder("payment_gateway_timeouts_total")
                .tag("operation", operation)
                .description("Payment gateway calls that exceeded the timeout")
                .register(meterRegistry)
                .increment();
    }

    public void recordGatewayRejected(String operation) {
        Counter.builder("payment_gateway_rejected_total")
                .tag("operation", operation)
                .description("Payment gateway calls rejected by a saturated executor")
                .register(meterRegistry)
                .increment();
    }

    // ============================================================
    // 웹훅 관련 메트릭
    // ============================================================

    public void recordWebhook(String result) {
        Counter.builder("webhook_events_total")
                .tag("result", result)
                .description("Payment webhook processing results")
                .register(meterRegistry)
                .increment();
    }
}
