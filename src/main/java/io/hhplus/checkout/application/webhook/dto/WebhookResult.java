package io.hhplus.checkout.application.webhook.dto;

/**
 * 웹훅 처리 결과
 *
 * 서명 실패를 제외한 모든 결과는 수신 확인(received=true, HTTP 200)으로 응답한다.
 */
public record WebhookResult(
    boolean received,
    String eventId,
    String eventType,
    Status status,
    String message
) {
    public enum Status {
        PROCESSED,
        IGNORED,
        DUPLICATE,
        FAILED
    }

    public static WebhookResult of(String eventId, String eventType, Status status, String message) {
        return new WebhookResult(true, eventId, eventType, status, message);
    }
}
