package io.hhplus.checkout.presentation.api.webhook;

import io.hhplus.checkout.application.webhook.FailedEventService;
import io.hhplus.checkout.application.webhook.WebhookService;
import io.hhplus.checkout.application.webhook.dto.FailedEventResponse;
import io.hhplus.checkout.application.webhook.dto.ResolveFailedEventRequest;
import io.hhplus.checkout.application.webhook.dto.WebhookResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookService webhookService;
    private final FailedEventService failedEventService;

    /**
     * 결제 대행사 웹훅 수신
     *
     * 서명 검증에 원문 바이트가 필요하므로 본문을 문자열 그대로 받는다.
     * 서명 실패(400)를 제외하면 항상 200으로 수신을 확인한다.
     */
    @PostMapping("/payments")
    public ResponseEntity<WebhookResult> receivePaymentEvent(
            @RequestHeader(value = "Stripe-Signature", required = false) String signature,
            @RequestBody String payload
    ) {
        return ResponseEntity.ok(webhookService.handle(payload, signature));
    }

    @GetMapping("/failed-events")
    public ResponseEntity<List<FailedEventResponse>> getPendingFailedEvents() {
        return ResponseEntity.ok(failedEventService.getPendingEvents());
    }

    @PostMapping("/failed-events/{failedEventId}/resolve")
    public ResponseEntity<FailedEventResponse> resolveFailedEvent(
            @PathVariable Long failedEventId,
            @Valid @RequestBody ResolveFailedEventRequest request
    ) {
        return ResponseEntity.ok(failedEventService.resolve(failedEventId, request.note()));
    }
}
