package io.hhplus.checkout.presentation.api.payment;

import io.hhplus.checkout.application.payment.PaymentService;
import io.hhplus.checkout.application.payment.dto.*;
import io.hhplus.checkout.domain.payment.Currency;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Validated
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping("/intents")
    public ResponseEntity<PaymentIntentResponse> createIntent(@Valid @RequestBody CreatePaymentIntentRequest request) {
        Currency currency = request.currency() != null ? request.currency() : paymentService.getDefaultCurrency();
        Map<String, String> metadata = request.metadata() != null ? request.metadata() : Map.of();
        PaymentIntentResponse response = paymentService.createIntent(request.orderId(), request.amount(), currency, metadata);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/intents/{paymentIntentId}/confirm")
    public ResponseEntity<PaymentIntentResponse> confirm(
            @PathVariable Long paymentIntentId,
            @Valid @RequestBody ConfirmPaymentRequest request
    ) {
        return ResponseEntity.ok(paymentService.confirm(paymentIntentId, request.paymentMethodId()));
    }

    @PostMapping("/orders/{orderId}/refunds")
    public ResponseEntity<RefundResponse> refund(
            @PathVariable Long orderId,
            @Valid @RequestBody(required = false) RefundRequest request
    ) {
        RefundResponse response = request != null
            ? paymentService.refund(orderId, request.amount(), request.reason())
            : paymentService.refund(orderId, null, null);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/orders/{orderId}/status")
    public ResponseEntity<PaymentStatusResponse> getPaymentStatus(@PathVariable Long orderId) {
        return ResponseEntity.ok(paymentService.getPaymentStatus(orderId));
    }
}
