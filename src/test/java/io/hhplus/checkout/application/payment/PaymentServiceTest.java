package io.hhplus.checkout.application.payment;

import io.hhplus.checkout.application.payment.dto.PaymentIntentResponse;
import io.hhplus.checkout.application.payment.dto.PaymentStatusResponse;
import io.hhplus.checkout.application.payment.dto.RefundResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.order.Address;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderItem;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.PaymentMethod;
import io.hhplus.checkout.domain.order.PaymentStatus;
import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;
import io.hhplus.checkout.domain.payment.PaymentSettledEvent;
import io.hhplus.checkout.domain.payment.RefundReason;
import io.hhplus.checkout.infrastructure.external.MockPaymentGateway;
import io.hhplus.checkout.infrastructure.external.PaymentGatewayClient;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import io.hhplus.checkout.infrastructure.persistence.order.InMemoryOrderRepository;
import io.hhplus.checkout.infrastructure.persistence.payment.InMemoryPaymentIntentRepository;
import io.hhplus.checkout.infrastructure.persistence.payment.InMemoryRefundRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

/**
 * 결제 오케스트레이터 테스트
 *
 * Mock 대행사 + InMemory Repository 조합.
 * 대행사 호출은 호출 스레드에서 바로 실행한다 (타임아웃 케이스 제외).
 */
class PaymentServiceTest {

    private static final Long USER_ID = 1L;

    private InMemoryOrderRepository orderRepository;
    private InMemoryPaymentIntentRepository paymentIntentRepository;
    private MetricsCollector metricsCollector;
    private PaymentTransactionService transactionService;
    private PaymentSettlementService settlementService;
    private MockPaymentGateway paymentGateway;
    private PaymentService paymentService;
    private List<Object> publishedEvents;
    private ExecutorService slowExecutor;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        paymentIntentRepository = new InMemoryPaymentIntentRepository();
        metricsCollector = new MetricsCollector(new SimpleMeterRegistry());
        publishedEvents = new ArrayList<>();
        ApplicationEventPublisher eventPublisher = event -> publishedEvents.add(event);

        settlementService = new PaymentSettlementService(orderRepository, paymentIntentRepository,
            eventPublisher, metricsCollector);
        paymentGateway = new MockPaymentGateway();
        paymentService = paymentService(false);
    }

    private PaymentService paymentService(boolean partialRefundMarksRefunded) {
        ApplicationEventPublisher eventPublisher = event -> publishedEvents.add(event);
        transactionService = new PaymentTransactionService(orderRepository, paymentIntentRepository,
            new InMemoryRefundRepository(), eventPublisher, metricsCollector, partialRefundMarksRefunded);
        PaymentGatewayClient gatewayClient = new PaymentGatewayClient(paymentGateway, Runnable::run, metricsCollector, 1000);
        return new PaymentService(transactionService, settlementService, gatewayClient,
            paymentIntentRepository, orderRepository, "usd");
    }

    @AfterEach
    void tearDown() {
        if (slowExecutor != null) {
            slowExecutor.shutdownNow();
        }
    }

    /**
     * 49.99 x 2 = 99.98
     */
    private Order saveOrder() {
        Address address = Address.of("김항해", "테헤란로 1", null, "서울", null, "06000", "KR", null);
        Order order = Order.create(Order.generateOrderNumber(LocalDate.now()), USER_ID, address, null,
            PaymentMethod.GATEWAY_CARD, null);
        OrderItem.create(order, 10L, "무선 이어폰", 2, new BigDecimal("49.99"));
        return orderRepository.save(order);
    }

    private Order paidOrder() {
        Order order = saveOrder();
        PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());
        paymentService.confirm(intent.paymentIntentId(), "pm_card_visa");
        return order;
    }

    @Nested
    @DisplayName("결제 요청 생성")
    class CreateIntent {

        @Test
        @DisplayName("주문 총액과 기본 통화로 생성되고 주문 정보가 metadata에 담긴다")
        void createIntent_성공() {
            Order order = saveOrder();

            PaymentIntentResponse response = paymentService.createIntent(order.getId(), null, null, Map.of("channel", "web"));

            assertThat(response.paymentIntentId()).isNotNull();
            assertThat(response.gatewayIntentId()).startsWith("pi_mock_");
            assertThat(response.clientSecret()).isNotBlank();
            assertThat(response.amount()).isEqualByComparingTo("99.98");
            assertThat(response.currency()).isEqualTo(Currency.USD);
            assertThat(response.status()).isEqualTo(PaymentIntentStatus.REQUIRES_ACTION);
            assertThat(paymentIntentRepository.findByIdOrThrow(response.paymentIntentId()).getMetadata())
                .containsEntry("orderId", String.valueOf(order.getId()))
                .containsEntry("orderNumber", order.getOrderNumber())
                .containsEntry("channel", "web");
        }

        @Test
        @DisplayName("승인 대기 intent가 있으면 새로 만들지 않고 그대로 반환")
        void createIntent_기존intent반환() {
            Order order = saveOrder();
            PaymentIntentResponse first = paymentService.createIntent(order.getId(), null, null, Map.of());

            PaymentIntentResponse second = paymentService.createIntent(order.getId(), null, Currency.EUR, Map.of());

            assertThat(second.paymentIntentId()).isEqualTo(first.paymentIntentId());
            assertThat(second.gatewayIntentId()).isEqualTo(first.gatewayIntentId());
            assertThat(second.currency()).isEqualTo(Currency.USD);
        }

        @Test
        @DisplayName("실패 - 이미 결제된 주문은 ALREADY_PAID")
        void createIntent_결제완료_예외발생() {
            Order order = paidOrder();

            assertThatThrownBy(() -> paymentService.createIntent(order.getId(), null, null, Map.of()))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ALREADY_PAID);
        }

        @Test
        @DisplayName("실패 - 취소된 주문은 ORDER_CANCELLED")
        void createIntent_취소주문_예외발생() {
            Order order = saveOrder();
            order.cancel("단순 변심");

            assertThatThrownBy(() -> paymentService.createIntent(order.getId(), null, null, Map.of()))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ORDER_CANCELLED);
        }

        @Test
        @DisplayName("실패 - 요청 금액이 주문 총액과 다르면 INVALID_PAYMENT_AMOUNT")
        void createIntent_금액불일치_예외발생() {
            Order order = saveOrder();

            assertThatThrownBy(() -> paymentService.createIntent(order.getId(), new BigDecimal("10.00"), null, Map.of()))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PAYMENT_AMOUNT);
            assertThat(paymentIntentRepository.findByOrderId(order.getId())).isEmpty();
        }

        @Test
        @DisplayName("실패 - 결제 실패 후에는 새 결제 요청을 만들 수 없다")
        void createIntent_결제실패후_예외발생() {
            Order order = saveOrder();
            PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());
            paymentService.confirm(intent.paymentIntentId(), "pm_card_fail");

            assertThatThrownBy(() -> paymentService.createIntent(order.getId(), null, null, Map.of()))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PAYMENT_NOT_ALLOWED);
        }
    }

    @Nested
    @DisplayName("결제 승인")
    class Confirm {

        @Test
        @DisplayName("성공 - intent SUCCEEDED, 주문 PAID + CONFIRMED, 정산 이벤트 발행")
        void confirm_성공() {
            Order order = saveOrder();
            PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());

            PaymentIntentResponse confirmed = paymentService.confirm(intent.paymentIntentId(), "pm_card_visa");

            assertThat(confirmed.status()).isEqualTo(PaymentIntentStatus.SUCCEEDED);
            assertThat(confirmed.capturedAmount()).isEqualByComparingTo("99.98");
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.getPaidAt()).isNotNull();
            assertThat(publishedEvents).filteredOn(PaymentSettledEvent.class::isInstance)
                .singleElement()
                .extracting("paymentStatus", "source")
                .containsExactly(PaymentStatus.PAID, "confirm");
        }

        @Test
        @DisplayName("카드 거절 - 예외가 아니라 FAILED intent로 반환, 주문 결제 상태 FAILED")
        void confirm_카드거절() {
            Order order = saveOrder();
            PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());

            PaymentIntentResponse confirmed = paymentService.confirm(intent.paymentIntentId(), "pm_card_fail");

            assertThat(confirmed.status()).isEqualTo(PaymentIntentStatus.FAILED);
            assertThat(confirmed.failureReason()).isEqualTo("card_declined");
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        }

        @Test
        @DisplayName("대행사 오류 - GATEWAY_ERROR(재시도 가능), 로컬 상태 변화 없음")
        void confirm_대행사오류_예외발생() {
            Order order = saveOrder();
            PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());

            BusinessException exception = catchThrowableOfType(
                () -> paymentService.confirm(intent.paymentIntentId(), "pm_error"), BusinessException.class);

            assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.GATEWAY_ERROR);
            assertThat(exception.isRetryable()).isTrue();
            assertThat(exception.isOutcomeUnknown()).isFalse();
            assertThat(paymentIntentRepository.findByIdOrThrow(intent.paymentIntentId()).getStatus())
                .isEqualTo(PaymentIntentStatus.REQUIRES_ACTION);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        }

        @Test
        @DisplayName("대행사 타임아웃 - GATEWAY_TIMEOUT(결과 불명), 로컬 상태 변화 없음")
        void confirm_타임아웃_결과불명() {
            // Given
            slowExecutor = Executors.newSingleThreadExecutor();
            PaymentGatewayClient slowClient = new PaymentGatewayClient(paymentGateway, slowExecutor, metricsCollector, 100);
            PaymentService timeoutPaymentService = new PaymentService(transactionService, settlementService, slowClient,
                paymentIntentRepository, orderRepository, "usd");
            Order order = saveOrder();
            PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());

            // When
            BusinessException exception = catchThrowableOfType(
                () -> timeoutPaymentService.confirm(intent.paymentIntentId(), "pm_slow"), BusinessException.class);

            // Then
            assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.GATEWAY_TIMEOUT);
            assertThat(exception.isOutcomeUnknown()).isTrue();
            assertThat(exception.isRetryable()).isTrue();
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        }

        @Test
        @DisplayName("이미 성공한 intent는 대행사 호출 없이 그대로 반환")
        void confirm_이미성공_멱등() {
            Order order = saveOrder();
            PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());
            paymentService.confirm(intent.paymentIntentId(), "pm_card_visa");

            PaymentIntentResponse again = paymentService.confirm(intent.paymentIntentId(), "pm_error");

            assertThat(again.status()).isEqualTo(PaymentIntentStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("실패 - 실패한 intent는 다시 승인할 수 없다")
        void confirm_실패intent_예외발생() {
            Order order = saveOrder();
            PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());
            paymentService.confirm(intent.paymentIntentId(), "pm_card_fail");

            assertThatThrownBy(() -> paymentService.confirm(intent.paymentIntentId(), "pm_card_visa"))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PAYMENT_INTENT_NOT_CONFIRMABLE);
        }

        @Test
        @DisplayName("실패 - 존재하지 않는 intent")
        void confirm_없는intent_예외발생() {
            assertThatThrownBy(() -> paymentService.confirm(999L, "pm_card_visa"))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PAYMENT_INTENT_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("환불")
    class Refund {

        @Test
        @DisplayName("부분 환불 후 잔액 환불 - 두 번째에서 REFUNDED")
        void refund_부분후전액() {
            // Given
            Order order = paidOrder();

            // When
            RefundResponse partial = paymentService.refund(order.getId(), new BigDecimal("40.00"), null);
            RefundResponse rest = paymentService.refund(order.getId(), null, RefundReason.DUPLICATE);

            // Then
            assertThat(partial.fullRefund()).isFalse();
            assertThat(partial.paymentStatus()).isEqualTo(PaymentStatus.PAID);
            assertThat(partial.remainingRefundableAmount()).isEqualByComparingTo("59.98");
            assertThat(partial.reason()).isEqualTo(RefundReason.REQUESTED_BY_CUSTOMER);
            assertThat(partial.gatewayRefundId()).startsWith("re_mock_");

            assertThat(rest.amount()).isEqualByComparingTo("59.98");
            assertThat(rest.fullRefund()).isTrue();
            assertThat(rest.paymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(rest.remainingRefundableAmount()).isEqualByComparingTo("0");
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
        }

        @Test
        @DisplayName("실패 - 환불 가능 금액 초과")
        void refund_초과_예외발생() {
            Order order = paidOrder();

            assertThatThrownBy(() -> paymentService.refund(order.getId(), new BigDecimal("100.00"), null))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.REFUND_AMOUNT_EXCEEDS_CAPTURED);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        }

        @Test
        @DisplayName("실패 - 결제되지 않은 주문은 NOT_PAID")
        void refund_미결제_예외발생() {
            Order order = saveOrder();

            assertThatThrownBy(() -> paymentService.refund(order.getId(), null, null))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_PAID);
        }

        @Test
        @DisplayName("부분 환불도 REFUNDED로 처리하는 설정 - 첫 부분 환불에서 REFUNDED, 이후 환불은 NOT_PAID")
        void refund_부분환불즉시REFUNDED설정() {
            // Given
            paymentService = paymentService(true);
            Order order = paidOrder();

            // When
            RefundResponse partial = paymentService.refund(order.getId(), new BigDecimal("40.00"), null);

            // Then
            assertThat(partial.fullRefund()).isFalse();
            assertThat(partial.paymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(partial.remainingRefundableAmount()).isEqualByComparingTo("59.98");
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(publishedEvents.stream()
                .filter(PaymentSettledEvent.class::isInstance)
                .map(event -> ((PaymentSettledEvent) event).paymentStatus())
                .toList())
                .containsExactly(PaymentStatus.PAID, PaymentStatus.REFUNDED);

            assertThatThrownBy(() -> paymentService.refund(order.getId(), new BigDecimal("10.00"), null))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_PAID);
        }

        @Test
        @DisplayName("실패 - 전액 환불 후 추가 환불은 NOT_PAID")
        void refund_전액환불후_예외발생() {
            Order order = paidOrder();
            paymentService.refund(order.getId(), null, null);

            assertThatThrownBy(() -> paymentService.refund(order.getId(), new BigDecimal("1.00"), null))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_PAID);
        }
    }

    @Test
    @DisplayName("결제 상태 조회 - 로컬 상태와 대행사 실시간 상태")
    void getPaymentStatus_대행사상태포함() {
        Order order = saveOrder();
        PaymentIntentResponse intent = paymentService.createIntent(order.getId(), null, null, Map.of());

        PaymentStatusResponse status = paymentService.getPaymentStatus(order.getId());

        assertThat(status.paymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(status.paymentIntentId()).isEqualTo(intent.paymentIntentId());
        assertThat(status.intentStatus()).isEqualTo(PaymentIntentStatus.REQUIRES_ACTION);
        assertThat(status.gatewayStatus()).isEqualTo(PaymentIntentStatus.REQUIRES_ACTION);
    }

    @Test
    @DisplayName("결제 상태 조회 - intent가 없으면 intent 정보는 비어 있다")
    void getPaymentStatus_intent없음() {
        Order order = saveOrder();

        PaymentStatusResponse status = paymentService.getPaymentStatus(order.getId());

        assertThat(status.totalAmount()).isEqualByComparingTo("99.98");
        assertThat(status.paymentIntentId()).isNull();
        assertThat(status.gatewayStatus()).isNull();
    }
}
