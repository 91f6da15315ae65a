package io.hhplus.checkout.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 에러 종류 (응답 상태 결정의 기준)
 *
 * ErrorCode는 구체적인 실패 사유, ErrorKind는 호출자가 취할 행동을 결정한다.
 * - retryable=false: 같은 요청을 다시 보내도 결과가 같다 (NOT_FOUND, INVALID_STATE 등)
 * - retryable=true: 일시적 실패일 수 있다 (GATEWAY_ERROR, 타임아웃, 락 경합)
 *
 * 메시지 문자열로 종류를 추론하지 않는다. 모든 예외는 ErrorCode를 통해 종류를 명시한다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    NOT_FOUND(false),
    INVALID_STATE(false),
    INSUFFICIENT_STOCK(false),
    ITEM_UNAVAILABLE(false),
    ALREADY_EXISTS(false),
    VALIDATION_FAILED(false),
    GATEWAY_ERROR(true),
    SIGNATURE_INVALID(false),
    /**
     * 같은 자원에 대한 요청이 처리 중 (분산 락 획득 실패)
     */
    CONCURRENCY_CONFLICT(true),
    INTERNAL(false);

    private final boolean retryable;
}
