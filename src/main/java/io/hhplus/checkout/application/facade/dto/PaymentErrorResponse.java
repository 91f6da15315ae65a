package io.hhplus.checkout.application.facade.dto;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorKind;

/**
 * 체크아웃 중 결제 요청 생성 실패 정보
 * 주문은 생성된 상태이므로 예외 대신 응답에 담아 돌려준다.
 */
public record PaymentErrorResponse(
    String code,
    ErrorKind kind,
    String message,
    boolean retryable,
    boolean outcomeUnknown
) {
    public static PaymentErrorResponse from(BusinessException e) {
        return new PaymentErrorResponse(
            e.getCode(),
            e.getKind(),
            e.getMessage(),
            e.isRetryable(),
            e.isOutcomeUnknown()
        );
    }
}
