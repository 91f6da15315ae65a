package io.hhplus.checkout.presentation.api.payment;

import io.hhplus.checkout.application.payment.PaymentService;
import io.hhplus.checkout.application.payment.dto.PaymentIntentResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.payment.Currency;
import io.hhplus.checkout.domain.payment.PaymentIntentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 결제 API 웹 계층 테스트 (요청 검증, 에러 코드 → HTTP 상태 매핑)
 */
@WebMvcTest(PaymentController.class)
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PaymentService paymentService;

    @Test
    @DisplayName("결제 요청 생성 - 통화/metadata 생략 시 기본값으로 201")
    void createIntent_성공() throws Exception {
        when(paymentService.getDefaultCurrency()).thenReturn(Currency.USD);
        when(paymentService.createIntent(1L, null, Currency.USD, Map.of())).thenReturn(new PaymentIntentResponse(
            10L, 1L, "pi_1", "pi_1_secret", new BigDecimal("99.98"), Currency.USD,
            PaymentIntentStatus.REQUIRES_ACTION, BigDecimal.ZERO, BigDecimal.ZERO, null));

        mockMvc.perform(post("/api/payments/intents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"orderId\": 1}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.paymentIntentId").value(10))
            .andExpect(jsonPath("$.currency").value("usd"))
            .andExpect(jsonPath("$.status").value("REQUIRES_ACTION"));
    }

    @Test
    @DisplayName("결제 요청 생성 - orderId 누락은 400 + 필드 에러")
    void createIntent_필수값누락_400() throws Exception {
        mockMvc.perform(post("/api/payments/intents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("COMMON002"))
            .andExpect(jsonPath("$.kind").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details.orderId").exists());
        verifyNoInteractions(paymentService);
    }

    @Test
    @DisplayName("이미 결제된 주문 - 409, 재시도 불가")
    void createIntent_이미결제_409() throws Exception {
        when(paymentService.getDefaultCurrency()).thenReturn(Currency.USD);
        when(paymentService.createIntent(anyLong(), any(), any(), anyMap()))
            .thenThrow(new BusinessException(ErrorCode.ALREADY_PAID));

        mockMvc.perform(post("/api/payments/intents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"orderId\": 1}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("PAY001"))
            .andExpect(jsonPath("$.kind").value("INVALID_STATE"))
            .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("같은 주문의 결제 요청이 처리 중 - 409, 재시도 가능")
    void createIntent_락경합_409재시도가능() throws Exception {
        when(paymentService.getDefaultCurrency()).thenReturn(Currency.USD);
        when(paymentService.createIntent(anyLong(), any(), any(), anyMap()))
            .thenThrow(new BusinessException(ErrorCode.CONCURRENT_REQUEST));

        mockMvc.perform(post("/api/payments/intents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"orderId\": 1}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("COMMON003"))
            .andExpect(jsonPath("$.kind").value("CONCURRENCY_CONFLICT"))
            .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("대행사 타임아웃 - 504, 결과 불명 표시")
    void confirm_타임아웃_504() throws Exception {
        when(paymentService.confirm(10L, "pm_card_visa")).thenThrow(new BusinessException(ErrorCode.GATEWAY_TIMEOUT));

        mockMvc.perform(post("/api/payments/intents/10/confirm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paymentMethodId\": \"pm_card_visa\"}"))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.code").value("GW002"))
            .andExpect(jsonPath("$.retryable").value(true))
            .andExpect(jsonPath("$.outcomeUnknown").value(true));
    }

    @Test
    @DisplayName("대행사 오류 - 502, 재시도 가능")
    void confirm_대행사오류_502() throws Exception {
        when(paymentService.confirm(10L, "pm_error")).thenThrow(new BusinessException(ErrorCode.GATEWAY_ERROR));

        mockMvc.perform(post("/api/payments/intents/10/confirm")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paymentMethodId\": \"pm_error\"}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.kind").value("GATEWAY_ERROR"))
            .andExpect(jsonPath("$.retryable").value(true))
            .andExpect(jsonPath("$.outcomeUnknown").value(false));
    }

    @Test
    @DisplayName("환불 - 본문 없이 요청하면 잔액 전체 환불")
    void refund_본문없음_전액() throws Exception {
        mockMvc.perform(post("/api/payments/orders/1/refunds"))
            .andExpect(status().isCreated());

        verify(paymentService).refund(1L, null, null);
    }

    @Test
    @DisplayName("환불 - 지원하지 않는 사유는 400")
    void refund_잘못된사유_400() throws Exception {
        mockMvc.perform(post("/api/payments/orders/1/refunds")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 10.00, \"reason\": \"because\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("COMMON002"));
        verifyNoInteractions(paymentService);
    }

    @Test
    @DisplayName("환불 가능 금액 초과 - 400")
    void refund_초과_400() throws Exception {
        when(paymentService.refund(eq(1L), any(), any()))
            .thenThrow(new BusinessException(ErrorCode.REFUND_AMOUNT_EXCEEDS_CAPTURED));

        mockMvc.perform(post("/api/payments/orders/1/refunds")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 500.00}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("PAY007"));
    }
}
