package io.hhplus.checkout.application.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.checkout.application.payment.PaymentSettlementService;
import io.hhplus.checkout.application.webhook.dto.FailedEventResponse;
import io.hhplus.checkout.application.webhook.dto.WebhookResult;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.order.Address;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderItem;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.PaymentMethod;
import io.hhplus.checkout.domain.order.PaymentStatus;
import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.PaymentIntent;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import io.hhplus.checkout.infrastructure.persistence.event.InMemoryFailedEventRepository;
import io.hhplus.checkout.infrastructure.persistence.event.InMemoryProcessedEventStore;
import io.hhplus.checkout.infrastructure.persistence.order.InMemoryOrderRepository;
import io.hhplus.checkout.infrastructure.persistence.payment.InMemoryPaymentIntentRepository;
import io.hhplus.checkout.infrastructure.webhook.WebhookSignatureVerifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class WebhookServiceTest {

    private static final String SECRET = "whsec_test_secret";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String GATEWAY_INTENT_ID = "pi_test_0001";

    private WebhookSignatureVerifier signatureVerifier;
    private InMemoryOrderRepository orderRepository;
    private InMemoryPaymentIntentRepository paymentIntentRepository;
    private FailedEventService failedEventService;
    private SimpleMeterRegistry meterRegistry;
    private WebhookService webhookService;

    private Order order;

    @BeforeEach
    void setUp() {
        signatureVerifier = new WebhookSignatureVerifier(SECRET, 300, Clock.fixed(NOW, ZoneOffset.UTC));
        orderRepository = new InMemoryOrderRepository();
        paymentIntentRepository = new InMemoryPaymentIntentRepository();
        meterRegistry = new SimpleMeterRegistry();
        MetricsCollector metricsCollector = new MetricsCollector(meterRegistry);
        PaymentSettlementService settlementService = new PaymentSettlementService(
            orderRepository, paymentIntentRepository, event -> { }, metricsCollector);
        failedEventService = new FailedEventService(new InMemoryFailedEventRepository());

        webhookService = new WebhookService(signatureVerifier, new InMemoryProcessedEventStore(), settlementService,
            failedEventService, metricsCollector, new ObjectMapper(), 24);

        Address address = Address.of("김항해", "테헤란로 1", null, "서울", null, "06000", "KR", null);
        order = Order.create(Order.generateOrderNumber(LocalDate.now()), 1L, address, null, PaymentMethod.GATEWAY_CARD, null);
        OrderItem.create(order, 10L, "무선 이어폰", 1, new BigDecimal("25.00"));
        orderRepository.save(order);
        paymentIntentRepository.save(PaymentIntent.create(order.getId(), GATEWAY_INTENT_ID, "secret",
            new BigDecimal("25.00"), Currency.USD, Map.of("orderId", String.valueOf(order.getId()))));
    }

    private String event(String eventId, String type, String orderId) {
        String metadata = orderId != null ? "{\"orderId\":\"" + orderId + "\"}" : "{}";
        return "{\"id\":\"" + eventId + "\",\"type\":\"" + type + "\",\"data\":{\"object\":{"
            + "\"id\":\"" + GATEWAY_INTENT_ID + "\",\"object\":\"payment_intent\","
            + "\"last_payment_error\":{\"message\":\"Your card was declined.\"},"
            + "\"metadata\":" + metadata + "}}}";
    }

    private String sign(String payload) {
        return signatureVerifier.sign(payload, NOW.getEpochSecond());
    }

    private WebhookResult deliver(String payload) {
        return webhookService.handle(payload, sign(payload));
    }

    private double webhookCount(String result) {
        return meterRegistry.get("webhook_events_total").tag("result", result).counter().count();
    }

    @Test
    @DisplayName("결제 성공 이벤트 - 주문 PAID + CONFIRMED, intent SUCCEEDED")
    void handle_결제성공() {
        WebhookResult result = deliver(event("evt_1", WebhookService.PAYMENT_SUCCEEDED, String.valueOf(order.getId())));

        assertThat(result.received()).isTrue();
        assertThat(result.status()).isEqualTo(WebhookResult.Status.PROCESSED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(paymentIntentRepository.findByGatewayIntentId(GATEWAY_INTENT_ID).orElseThrow().getStatus())
            .isEqualTo(PaymentIntentStatus.SUCCEEDED);
        assertThat(webhookCount("processed")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("결제 실패 이벤트 - 실패 사유와 함께 주문 결제 상태 FAILED")
    void handle_결제실패() {
        WebhookResult result = deliver(event("evt_2", WebhookService.PAYMENT_FAILED, String.valueOf(order.getId())));

        assertThat(result.status()).isEqualTo(WebhookResult.Status.PROCESSED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(paymentIntentRepository.findByGatewayIntentId(GATEWAY_INTENT_ID).orElseThrow().getFailureReason())
            .isEqualTo("Your card was declined.");
    }

    @Test
    @DisplayName("결제 취소 이벤트 - 주문 결제 상태 FAILED, intent CANCELED")
    void handle_결제취소() {
        WebhookResult result = deliver(event("evt_3", WebhookService.PAYMENT_CANCELED, String.valueOf(order.getId())));

        assertThat(result.status()).isEqualTo(WebhookResult.Status.PROCESSED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(paymentIntentRepository.findByGatewayIntentId(GATEWAY_INTENT_ID).orElseThrow().getStatus())
            .isEqualTo(PaymentIntentStatus.CANCELED);
    }

    @Test
    @DisplayName("중복 이벤트 - 두 번째 전달은 DUPLICATE, 상태 변화 없음")
    void handle_중복이벤트() {
        String payload = event("evt_dup", WebhookService.PAYMENT_SUCCEEDED, String.valueOf(order.getId()));
        deliver(payload);

        WebhookResult second = deliver(payload);

        assertThat(second.status()).isEqualTo(WebhookResult.Status.DUPLICATE);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(webhookCount("duplicate")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("같은 이벤트 동시 전달 - 정확히 한 번만 처리")
    void handle_동시중복전달() throws Exception {
        String payload = event("evt_concurrent", WebhookService.PAYMENT_SUCCEEDED, String.valueOf(order.getId()));
        String signature = sign(payload);
        ExecutorService executor = Executors.newFixedThreadPool(5);

        List<Callable<WebhookResult>> deliveries = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            deliveries.add(() -> webhookService.handle(payload, signature));
        }
        List<WebhookResult> results = new ArrayList<>();
        for (Future<WebhookResult> future : executor.invokeAll(deliveries)) {
            results.add(future.get());
        }
        executor.shutdown();

        assertThat(results).filteredOn(result -> result.status() == WebhookResult.Status.PROCESSED).hasSize(1);
        assertThat(results).filteredOn(result -> result.status() == WebhookResult.Status.DUPLICATE).hasSize(4);
    }

    @Test
    @DisplayName("처리하지 않는 이벤트 타입 - IGNORED로 수신 확인")
    void handle_알수없는타입_무시() {
        WebhookResult result = deliver(event("evt_4", "charge.refunded", String.valueOf(order.getId())));

        assertThat(result.received()).isTrue();
        assertThat(result.status()).isEqualTo(WebhookResult.Status.IGNORED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    @DisplayName("허용되지 않는 전이 - 결제 완료 후 실패 통지는 IGNORED")
    void handle_결제완료후실패통지_무시() {
        deliver(event("evt_5", WebhookService.PAYMENT_SUCCEEDED, String.valueOf(order.getId())));

        WebhookResult result = deliver(event("evt_6", WebhookService.PAYMENT_FAILED, String.valueOf(order.getId())));

        assertThat(result.status()).isEqualTo(WebhookResult.Status.IGNORED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
    }

    @Test
    @DisplayName("서명 헤더 누락 - SIGNATURE_MISSING, 아무것도 처리하지 않음")
    void handle_서명누락_예외발생() {
        String payload = event("evt_7", WebhookService.PAYMENT_SUCCEEDED, String.valueOf(order.getId()));

        assertThatThrownBy(() -> webhookService.handle(payload, null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.SIGNATURE_MISSING);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    @DisplayName("서명 불일치 - SIGNATURE_INVALID, 중복 기록도 남기지 않음")
    void handle_서명불일치_예외발생() {
        String payload = event("evt_8", WebhookService.PAYMENT_SUCCEEDED, String.valueOf(order.getId()));
        String tampered = payload.replace("evt_8", "evt_9");

        assertThatThrownBy(() -> webhookService.handle(tampered, sign(payload)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.SIGNATURE_INVALID);

        // 올바른 서명으로 다시 보내면 정상 처리된다
        assertThat(deliver(tampered).status()).isEqualTo(WebhookResult.Status.PROCESSED);
    }

    @Test
    @DisplayName("orderId 누락 - FAILED로 수신 확인하고 실패 이벤트로 기록")
    void handle_orderId누락_실패기록() {
        WebhookResult result = deliver(event("evt_10", WebhookService.PAYMENT_SUCCEEDED, null));

        assertThat(result.received()).isTrue();
        assertThat(result.status()).isEqualTo(WebhookResult.Status.FAILED);
        List<FailedEventResponse> pending = failedEventService.getPendingEvents();
        assertThat(pending).singleElement()
            .extracting(FailedEventResponse::eventId)
            .isEqualTo("evt_10");
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    @DisplayName("처리 중 예외 - 중복 기록을 지워 재전송 시 다시 처리, 실패 횟수 누적")
    void handle_처리실패_재전송가능() {
        String payload = event("evt_11", WebhookService.PAYMENT_SUCCEEDED, "999999");

        WebhookResult first = deliver(payload);
        WebhookResult second = deliver(payload);

        assertThat(first.status()).isEqualTo(WebhookResult.Status.FAILED);
        assertThat(second.status()).isEqualTo(WebhookResult.Status.FAILED);
        assertThat(failedEventService.getPendingEvents()).singleElement()
            .extracting(FailedEventResponse::occurrenceCount)
            .isEqualTo(2);
        assertThat(webhookCount("failed")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("해석할 수 없는 본문 - FAILED로 수신 확인")
    void handle_JSON아님_실패기록() {
        WebhookResult result = deliver("not-a-json");

        assertThat(result.status()).isEqualTo(WebhookResult.Status.FAILED);
        assertThat(result.eventType()).isEqualTo("unparseable");
        assertThat(result.eventId()).startsWith("payload-");
        assertThat(failedEventService.getPendingEvents()).hasSize(1);
    }
}
