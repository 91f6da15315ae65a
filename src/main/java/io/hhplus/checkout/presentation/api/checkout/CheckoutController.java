package io.hhplus.checkout.presentation.api.checkout;

import io.hhplus.checkout.application.facade.CheckoutFacade;
import io.hhplus.checkout.application.facade.dto.CheckoutResponse;
import io.hhplus.checkout.application.order.dto.CreateOrderRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/checkout")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutFacade checkoutFacade;

    /**
     * 체크아웃 API
     *
     * 주문이 생성되면 결제 요청 생성 실패 여부와 관계없이 201을 반환한다.
     * 결제 요청 실패는 paymentError에 담긴다.
     */
    @PostMapping
    public ResponseEntity<CheckoutResponse> checkout(
        @RequestHeader("X-User-Id") Long userId,
        @Valid @RequestBody CreateOrderRequest request
    ) {
        CheckoutResponse response = checkoutFacade.checkout(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
