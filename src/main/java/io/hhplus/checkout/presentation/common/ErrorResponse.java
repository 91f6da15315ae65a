package io.hhplus.checkout.presentation.common;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.common.exception.ErrorKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorResponse {

    private final String code;
    private final ErrorKind kind;
    private final String message;
    private final boolean retryable;
    private final boolean outcomeUnknown;
    private final Object details;

    public static ErrorResponse of(BusinessException e) {
        return of(e, null);
    }

    public static ErrorResponse of(BusinessException e, Object details) {
        return new ErrorResponse(e.getCode(), e.getKind(), e.getMessage(), e.isRetryable(), e.isOutcomeUnknown(), details);
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, Object details) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getKind(), message, errorCode.isRetryable(), false, details);
    }
}
