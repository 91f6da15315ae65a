package io.hhplus.checkout.application.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.checkout.application.payment.PaymentSettlementService;
import io.hhplus.checkout.application.webhook.dto.WebhookResult;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.event.ProcessedEventStore;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import io.hhplus.checkout.infrastructure.webhook.WebhookSignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;

/**
 * 결제 대행사 웹훅 처리
 * <p>
 * 처리 순서:
 * 1. 서명 헤더 누락 → SIGNATURE_MISSING (다른 어떤 처리보다 먼저)
 * 2. 서명 검증 → SIGNATURE_INVALID (본문 파싱 전, 부수 효과 없음)
 * 3. 본문 파싱
 * 4. 이벤트 ID 중복 검사 (SET NX + TTL). 이미 처리한 ID는 아무것도 하지 않는다
 * 5. 이벤트 타입별 정산 (PaymentSettlementService)
 * <p>
 * 서명 실패 외의 실패(파싱 불가, 주문 ID 누락, 주문 없음, 예기치 않은 예외)는
 * 수신 확인으로 응답하고 FailedEvent로 기록한다. 중복 기록은 지워서 대행사 재전송을 다시 처리할 수 있게 한다.
 */
@Slf4j
@Service
public class WebhookService {

    static final String PAYMENT_SUCCEEDED = "payment_intent.succeeded";
    static final String PAYMENT_FAILED = "payment_intent.payment_failed";
    static final String PAYMENT_CANCELED = "payment_intent.canceled";

    private static final String UNPARSEABLE_EVENT_TYPE = "unparseable";
    private static final String SOURCE = "webhook";

    private final WebhookSignatureVerifier signatureVerifier;
    private final ProcessedEventStore processedEventStore;
    private final PaymentSettlementService settlementService;
    private final FailedEventService failedEventService;
    private final MetricsCollector metricsCollector;
    private final ObjectMapper objectMapper;
    private final Duration dedupTtl;

    public WebhookService(WebhookSignatureVerifier signatureVerifier,
                          ProcessedEventStore processedEventStore,
                          PaymentSettlementService settlementService,
                          FailedEventService failedEventService,
                          MetricsCollector metricsCollector,
                          ObjectMapper objectMapper,
                          @Value("${checkout.webhook.dedup-ttl-hours:24}") long dedupTtlHours) {
        this.signatureVerifier = signatureVerifier;
        this.processedEventStore = processedEventStore;
        this.settlementService = settlementService;
        this.failedEventService = failedEventService;
        this.metricsCollector = metricsCollector;
        this.objectMapper = objectMapper;
        this.dedupTtl = Duration.ofHours(dedupTtlHours);
    }

    /**
     * @throws BusinessException SIGNATURE_MISSING, SIGNATURE_INVALID (이 두 경우만 예외)
     */
    public WebhookResult handle(String payload, String signatureHeader) {
        // 1. 서명 헤더 누락
        if (signatureHeader == null || signatureHeader.isBlank()) {
            metricsCollector.recordWebhook("signature_missing");
            log.warn("Webhook rejected: missing signature header");
            throw new BusinessException(ErrorCode.SIGNATURE_MISSING);
        }

        // 2. 서명 검증 (파싱 전)
        String body = payload != null ? payload : "";
        try {
            signatureVerifier.verify(body, signatureHeader);
        } catch (BusinessException e) {
            metricsCollector.recordWebhook("signature_invalid");
            log.warn("Webhook rejected: {}", e.getMessage());
            throw e;
        }

        // 3. 본문 파싱
        JsonNode event;
        try {
            event = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            String eventId = "payload-" + UUID.nameUUIDFromBytes(body.getBytes(StandardCharsets.UTF_8));
            return fail(UNPARSEABLE_EVENT_TYPE, eventId, body, "웹훅 본문을 해석할 수 없습니다: " + e.getOriginalMessage(), false);
        }

        String eventId = textOrNull(event.path("id"));
        String eventType = textOrNull(event.path("type"));
        if (eventId == null || eventType == null) {
            String fallbackId = eventId != null
                ? eventId
                : "payload-" + UUID.nameUUIDFromBytes(body.getBytes(StandardCharsets.UTF_8));
            return fail(eventType != null ? eventType : UNPARSEABLE_EVENT_TYPE, fallbackId, body,
                "이벤트 id 또는 type이 없습니다", false);
        }

        // 4. 중복 검사
        if (!processedEventStore.markIfAbsent(eventId, dedupTtl)) {
            metricsCollector.recordWebhook("duplicate");
            log.info("Duplicate webhook event ignored: eventId={}, type={}", eventId, eventType);
            return WebhookResult.of(eventId, eventType, WebhookResult.Status.DUPLICATE, "이미 처리된 이벤트입니다");
        }

        // 5. 타입별 처리
        try {
            WebhookResult result = dispatch(eventId, eventType, event.path("data").path("object"));
            metricsCollector.recordWebhook(result.status().name().toLowerCase(Locale.ROOT));
            return result;
        } catch (Exception e) {
            log.error("Webhook event processing failed: eventId={}, type={}", eventId, eventType, e);
            return fail(eventType, eventId, body, e.getMessage(), true);
        }
    }

    private WebhookResult dispatch(String eventId, String eventType, JsonNode paymentIntent) {
        switch (eventType) {
            case PAYMENT_SUCCEEDED -> {
                boolean applied = settlementService.settleSucceeded(
                    extractOrderId(paymentIntent), extractGatewayIntentId(paymentIntent), SOURCE);
                return settled(eventId, eventType, applied);
            }
            case PAYMENT_FAILED -> {
                String failureReason = textOrNull(paymentIntent.path("last_payment_error").path("message"));
                boolean applied = settlementService.settleFailed(
                    extractOrderId(paymentIntent), extractGatewayIntentId(paymentIntent), failureReason, false, SOURCE);
                return settled(eventId, eventType, applied);
            }
            case PAYMENT_CANCELED -> {
                boolean applied = settlementService.settleFailed(
                    extractOrderId(paymentIntent), extractGatewayIntentId(paymentIntent), "canceled", true, SOURCE);
                return settled(eventId, eventType, applied);
            }
            default -> {
                log.info("Unhandled webhook event type: eventId={}, type={}", eventId, eventType);
                return WebhookResult.of(eventId, eventType, WebhookResult.Status.IGNORED, "처리하지 않는 이벤트 타입입니다");
            }
        }
    }

    private WebhookResult settled(String eventId, String eventType, boolean applied) {
        if (applied) {
            return WebhookResult.of(eventId, eventType, WebhookResult.Status.PROCESSED, null);
        }
        return WebhookResult.of(eventId, eventType, WebhookResult.Status.IGNORED, "허용되지 않는 결제 상태 전이입니다");
    }

    private WebhookResult fail(String eventType, String eventId, String payload, String errorMessage, boolean releaseDedup) {
        if (releaseDedup) {
            processedEventStore.remove(eventId);
        }
        try {
            failedEventService.record(eventType, eventId, payload, errorMessage);
        } catch (Exception recordError) {
            log.error("Failed to record webhook failure: eventId={}, type={}. Manual intervention required!",
                eventId, eventType, recordError);
        }
        metricsCollector.recordWebhook("failed");
        return WebhookResult.of(eventId, eventType, WebhookResult.Status.FAILED, errorMessage);
    }

    private Long extractOrderId(JsonNode paymentIntent) {
        String orderId = textOrNull(paymentIntent.path("metadata").path("orderId"));
        if (orderId == null) {
            throw new BusinessException(ErrorCode.WEBHOOK_PAYLOAD_INVALID, "결제 요청 metadata에 orderId가 없습니다");
        }
        try {
            return Long.parseLong(orderId);
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCode.WEBHOOK_PAYLOAD_INVALID, "orderId 형식이 올바르지 않습니다: " + orderId);
        }
    }

    private String extractGatewayIntentId(JsonNode paymentIntent) {
        String gatewayIntentId = textOrNull(paymentIntent.path("id"));
        if (gatewayIntentId == null) {
            throw new BusinessException(ErrorCode.WEBHOOK_PAYLOAD_INVALID, "결제 요청 id가 없습니다");
        }
        return gatewayIntentId;
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
