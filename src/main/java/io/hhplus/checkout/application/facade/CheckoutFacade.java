package io.hhplus.checkout.application.facade;

import io.hhplus.checkout.application.facade.dto.CheckoutResponse;
import io.hhplus.checkout.application.facade.dto.PaymentErrorResponse;
import io.hhplus.checkout.application.order.dto.CreateOrderRequest;
import io.hhplus.checkout.application.order.dto.OrderResponse;
import io.hhplus.checkout.application.payment.PaymentService;
import io.hhplus.checkout.application.payment.dto.PaymentIntentResponse;
import io.hhplus.checkout.application.usecase.order.CreateOrderUseCase;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 체크아웃 Facade
 * <p>
 * 플로우:
 * 1. 장바구니 검증 + 주문 생성 (CreateOrderUseCase, 재고 예약 포함)
 * 2. 카드 결제 수단이면 주문 금액으로 결제 요청 생성 (기본 통화)
 * 3. 주문 확인 메일/실시간 알림은 커밋 이후 이벤트 리스너가 비동기로 처리
 * <p>
 * 결제 요청 생성이 실패해도 주문은 pending으로 남고, 응답에 결제 에러를 담는다.
 * 클라이언트는 POST /api/payments/intents로 다시 시도할 수 있다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckoutFacade {

    private final CreateOrderUseCase createOrderUseCase;
    private final PaymentService paymentService;

    public CheckoutResponse checkout(Long userId, CreateOrderRequest request) {
        OrderResponse order = createOrderUseCase.execute(userId, request);

        if (!request.paymentMethod().isRequiresUpfrontIntent()) {
            log.info("Checkout completed without payment intent: orderId={}, paymentMethod={}",
                order.orderId(), request.paymentMethod());
            return CheckoutResponse.orderOnly(order);
        }

        try {
            PaymentIntentResponse intent = paymentService.createIntent(
                order.orderId(), null, paymentService.getDefaultCurrency(), Map.of());
            log.info("Checkout completed: orderId={}, paymentIntentId={}", order.orderId(), intent.paymentIntentId());
            return CheckoutResponse.withIntent(order, intent);
        } catch (BusinessException e) {
            log.warn("결제 요청 생성 실패, 주문은 pending 유지: orderId={}, code={}, outcomeUnknown={}",
                order.orderId(), e.getCode(), e.isOutcomeUnknown());
            return CheckoutResponse.withPaymentError(order, PaymentErrorResponse.from(e));
        } catch (RuntimeException e) {
            // 주문은 이미 커밋되었으므로 예상하지 못한 실패도 응답에 담는다
            log.error("결제 요청 생성 중 예기치 않은 오류, 주문은 pending 유지: orderId={}", order.orderId(), e);
            return CheckoutResponse.withPaymentError(order,
                PaymentErrorResponse.from(new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, e)));
        }
    }
}
