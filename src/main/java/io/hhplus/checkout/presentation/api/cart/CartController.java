package io.hhplus.checkout.presentation.api.cart;

import io.hhplus.checkout.application.cart.dto.*;
import io.hhplus.checkout.application.facade.CartFacade;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Validated
@RestController
@RequestMapping("/api/cart")
@RequiredArgsConstructor
public class CartController {

    private final CartFacade cartFacade;

    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(cartFacade.getCart(userId));
    }

    @PostMapping("/items")
    public ResponseEntity<CartResponse> addItem(
        @RequestHeader("X-User-Id") Long userId,
        @Valid @RequestBody AddCartItemRequest request
    ) {
        CartResponse response = cartFacade.addItem(userId, request);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(response);
    }

    @PutMapping("/items/{itemId}")
    public ResponseEntity<CartItemUpdateResult> updateItem(
        @RequestHeader("X-User-Id") Long userId,
        @PathVariable Long itemId,
        @Valid @RequestBody UpdateCartItemRequest request
    ) {
        CartItemUpdateResult response = cartFacade.updateItem(userId, itemId, request.quantity());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/items/{itemId}")
    public ResponseEntity<Void> removeItem(
        @RequestHeader("X-User-Id") Long userId,
        @PathVariable Long itemId
    ) {
        cartFacade.removeItem(userId, itemId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Integer>> clear(@RequestHeader("X-User-Id") Long userId) {
        int removed = cartFacade.clear(userId);
        return ResponseEntity.ok(Map.of("removedItems", removed));
    }

    @GetMapping("/validate")
    public ResponseEntity<CartValidationResponse> validate(@RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(cartFacade.validate(userId));
    }
}
