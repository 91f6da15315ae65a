package io.hhplus.checkout.presentation.common;

import io.hhplus.checkout.application.cart.CartValidationException;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.common.exception.ErrorKind;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 예외 → HTTP 응답 변환
 * 상태 코드는 ErrorKind로만 결정한다 (메시지로 추론하지 않음).
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CartValidationException.class)
    public ResponseEntity<ErrorResponse> handleCartValidationException(CartValidationException e) {
        log.warn("Cart validation failed: code={}, issues={}", e.getCode(), e.getIssues().size());
        return ResponseEntity.status(mapErrorKindToHttpStatus(e))
            .body(ErrorResponse.of(e, e.getIssues()));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        if (e.getKind() == ErrorKind.GATEWAY_ERROR || e.getKind() == ErrorKind.INTERNAL) {
            log.error("Business exception occurred: code={}, message={}", e.getCode(), e.getMessage(), e);
        } else {
            log.warn("Business exception occurred: code={}, message={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(mapErrorKindToHttpStatus(e)).body(ErrorResponse.of(e));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
            .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        log.warn("Request validation failed: {}", fieldErrors);

        return ResponseEntity.badRequest().body(ErrorResponse.of(
            ErrorCode.INVALID_INPUT,
            ErrorCode.INVALID_INPUT.getMessage(),
            fieldErrors
        ));
    }

    @ExceptionHandler({
        ConstraintViolationException.class,
        HttpMessageNotReadableException.class,
        MissingRequestHeaderException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        // 요청 본문의 enum 변환 실패 등은 원인 BusinessException의 메시지를 그대로 쓴다
        String message = ErrorCode.INVALID_INPUT.getMessage();
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof BusinessException) {
                message = cause.getMessage();
                break;
            }
            cause = cause.getCause();
        }
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.INVALID_INPUT, message, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(
            ErrorCode.INTERNAL_SERVER_ERROR,
            ErrorCode.INTERNAL_SERVER_ERROR.getMessage(),
            null
        ));
    }

    private HttpStatus mapErrorKindToHttpStatus(BusinessException e) {
        if (e.isOutcomeUnknown()) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return switch (e.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE, INSUFFICIENT_STOCK, ALREADY_EXISTS, CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case ITEM_UNAVAILABLE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
            case GATEWAY_ERROR -> HttpStatus.BAD_GATEWAY;
            case SIGNATURE_INVALID -> HttpStatus.BAD_REQUEST;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
