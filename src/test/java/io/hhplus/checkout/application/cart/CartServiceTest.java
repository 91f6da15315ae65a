package io.hhplus.checkout.application.cart;

import io.hhplus.checkout.application.cart.dto.*;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.product.Product;
import io.hhplus.checkout.infrastructure.persistence.cart.InMemoryCartItemRepository;
import io.hhplus.checkout.infrastructure.persistence.cart.InMemoryCartRepository;
import io.hhplus.checkout.infrastructure.persistence.product.InMemoryProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * CartService 단위 테스트 (InMemory Repository 사용)
 */
class CartServiceTest {

    private static final Long USER_ID = 1L;

    private InMemoryProductRepository productRepository;
    private InMemoryCartItemRepository cartItemRepository;
    private CartService cartService;

    private Product keyboard;
    private Product mouse;

    @BeforeEach
    void setUp() {
        productRepository = new InMemoryProductRepository();
        cartItemRepository = new InMemoryCartItemRepository();
        cartService = new CartService(new InMemoryCartRepository(), cartItemRepository, productRepository);

        keyboard = productRepository.save(Product.create("키보드", new BigDecimal("19.99"), 10));
        mouse = productRepository.save(Product.create("마우스", new BigDecimal("5.50"), 3));
    }

    // ====================================
    // 장바구니 담기
    // ====================================

    @Test
    @DisplayName("장바구니 담기 - 장바구니가 없으면 생성하고 합계를 계산")
    void addItem_성공_장바구니자동생성() {
        // When
        CartResponse response = cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 2));

        // Then
        assertThat(response.userId()).isEqualTo(USER_ID);
        assertThat(response.items()).hasSize(1);
        assertThat(response.summary().totalQuantity()).isEqualTo(2);
        assertThat(response.summary().totalAmount()).isEqualByComparingTo("39.98");
    }

    @Test
    @DisplayName("장바구니 담기 - 같은 상품은 수량 합산")
    void addItem_중복상품_수량합산() {
        // Given
        cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 2));

        // When
        CartResponse response = cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 3));

        // Then
        assertThat(response.items()).hasSize(1);
        assertThat(response.items().get(0).quantity()).isEqualTo(5);
    }

    @Test
    @DisplayName("장바구니 담기 실패 - 합산 수량이 재고 초과")
    void addItem_재고초과_예외발생() {
        cartService.addItem(USER_ID, new AddCartItemRequest(mouse.getId(), 2));

        assertThatThrownBy(() -> cartService.addItem(USER_ID, new AddCartItemRequest(mouse.getId(), 2)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INSUFFICIENT_STOCK);

        assertThat(cartService.getCart(USER_ID).items().get(0).quantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("장바구니 담기 실패 - 판매 중지 상품")
    void addItem_판매중지_예외발생() {
        keyboard.deactivate();

        assertThatThrownBy(() -> cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 1)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRODUCT_UNAVAILABLE);
    }

    @Test
    @DisplayName("장바구니 담기 실패 - 없는 상품")
    void addItem_상품없음_예외발생() {
        assertThatThrownBy(() -> cartService.addItem(USER_ID, new AddCartItemRequest(999L, 1)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRODUCT_NOT_FOUND);
    }

    @Test
    @DisplayName("장바구니 담기 실패 - 상품당 100개 초과")
    void addItem_최대수량초과_예외발생() {
        Product bulk = productRepository.save(Product.create("볼펜", new BigDecimal("1.00"), 1000));
        cartService.addItem(USER_ID, new AddCartItemRequest(bulk.getId(), 100));

        assertThatThrownBy(() -> cartService.addItem(USER_ID, new AddCartItemRequest(bulk.getId(), 1)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CART_ITEM_QUANTITY_EXCEEDED);
    }

    // ====================================
    // 수량 변경 / 삭제
    // ====================================

    @Test
    @DisplayName("수량 변경 - UPDATED")
    void updateItem_성공() {
        Long cartItemId = cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 2))
            .items().get(0).cartItemId();

        CartItemUpdateResult result = cartService.updateItem(USER_ID, cartItemId, 4);

        assertThat(result.outcome()).isEqualTo(CartItemUpdateResult.Outcome.UPDATED);
        assertThat(result.item().quantity()).isEqualTo(4);
    }

    @Test
    @DisplayName("수량 0으로 변경 - 아이템 삭제, REMOVED")
    void updateItem_수량0_삭제() {
        Long cartItemId = cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 2))
            .items().get(0).cartItemId();

        CartItemUpdateResult result = cartService.updateItem(USER_ID, cartItemId, 0);

        assertThat(result.outcome()).isEqualTo(CartItemUpdateResult.Outcome.REMOVED);
        assertThat(result.item()).isNull();
        assertThat(cartService.getCart(USER_ID).items()).isEmpty();
    }

    @Test
    @DisplayName("다른 사용자의 아이템은 찾을 수 없음")
    void updateItem_타인아이템_예외발생() {
        Long cartItemId = cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 2))
            .items().get(0).cartItemId();
        cartService.addItem(2L, new AddCartItemRequest(mouse.getId(), 1));

        assertThatThrownBy(() -> cartService.updateItem(2L, cartItemId, 1))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CART_ITEM_NOT_FOUND);
        assertThatThrownBy(() -> cartService.removeItem(2L, cartItemId))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CART_ITEM_NOT_FOUND);
    }

    @Test
    @DisplayName("장바구니 비우기 - 삭제된 아이템 수 반환")
    void clear_성공() {
        cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 1));
        cartService.addItem(USER_ID, new AddCartItemRequest(mouse.getId(), 1));

        int removed = cartService.clear(USER_ID);

        assertThat(removed).isEqualTo(2);
        assertThat(cartService.getCart(USER_ID).items()).isEmpty();
        assertThat(cartService.clear(USER_ID)).isZero();
    }

    // ====================================
    // 검증
    // ====================================

    @Test
    @DisplayName("검증 - 빈 장바구니는 empty=true, valid=false")
    void validate_빈장바구니() {
        CartValidationResponse response = cartService.validate(USER_ID);

        assertThat(response.empty()).isTrue();
        assertThat(response.valid()).isFalse();
    }

    @Test
    @DisplayName("검증 - 실패 항목을 모두 모은다 (재고 부족 + 판매 중지)")
    void validate_실패항목전체수집() {
        // Given: 담은 뒤 재고가 줄고, 다른 상품은 판매 중지
        cartService.addItem(USER_ID, new AddCartItemRequest(mouse.getId(), 3));
        cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 1));
        productRepository.decreaseStockIfAvailable(mouse.getId(), 2);
        keyboard.deactivate();

        // When
        CartValidationResponse response = cartService.validate(USER_ID);

        // Then
        assertThat(response.valid()).isFalse();
        assertThat(response.issues())
            .extracting(CartItemIssue::reason)
            .containsExactlyInAnyOrder(CartItemIssue.Reason.INSUFFICIENT_STOCK, CartItemIssue.Reason.INACTIVE);
    }

    @Test
    @DisplayName("체크아웃 검증 - 빈 장바구니는 CART_EMPTY")
    void validateForCheckout_빈장바구니_예외발생() {
        assertThatThrownBy(() -> cartService.validateForCheckout(USER_ID))
            .isInstanceOf(CartValidationException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CART_EMPTY);
    }

    @Test
    @DisplayName("체크아웃 검증 - 판매 중지 상품이 있으면 PRODUCT_UNAVAILABLE")
    void validateForCheckout_판매중지_예외발생() {
        cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 1));
        keyboard.deactivate();

        CartValidationException exception = catchThrowableOfType(
            () -> cartService.validateForCheckout(USER_ID), CartValidationException.class);

        assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.PRODUCT_UNAVAILABLE);
        assertThat(exception.getIssues()).hasSize(1);
        assertThat(exception.getIssues().get(0).reason()).isEqualTo(CartItemIssue.Reason.INACTIVE);
    }

    @Test
    @DisplayName("체크아웃 검증 - 통과 시 현재 상품 가격으로 주문 아이템 반환")
    void validateForCheckout_성공() {
        cartService.addItem(USER_ID, new AddCartItemRequest(keyboard.getId(), 2));

        List<CheckoutItem> items = cartService.validateForCheckout(USER_ID);

        assertThat(items).hasSize(1);
        assertThat(items.get(0).unitPrice()).isEqualByComparingTo("19.99");
        assertThat(items.get(0).quantity()).isEqualTo(2);
    }
}
