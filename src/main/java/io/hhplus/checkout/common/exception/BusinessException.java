package io.hhplus.checkout.common.exception;

import lombok.Getter;

/**
 * 비즈니스 로직 예외
 * 도메인/애플리케이션 계층의 규칙 위반은 모두 이 예외로 표현한다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage) {
        super(customMessage);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public ErrorKind getKind() {
        return errorCode.getKind();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    /**
     * 결과를 알 수 없는 실패 (타임아웃)
     * 호출자는 재시도 전에 주문/결제 상태를 다시 조회해야 한다.
     */
    public boolean isOutcomeUnknown() {
        return errorCode == ErrorCode.GATEWAY_TIMEOUT;
    }
}
