package io.hhplus.checkout.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorCodeTest {

    @Test
    @DisplayName("락 경합은 일시적 실패이므로 재시도 가능")
    void concurrentRequest_재시도가능() {
        BusinessException exception = new BusinessException(ErrorCode.CONCURRENT_REQUEST);

        assertThat(exception.getKind()).isEqualTo(ErrorKind.CONCURRENCY_CONFLICT);
        assertThat(exception.isRetryable()).isTrue();
        assertThat(exception.isOutcomeUnknown()).isFalse();
    }

    @Test
    @DisplayName("내부 오류는 재시도해도 결과가 같으므로 재시도 불가")
    void internal_재시도불가() {
        assertThat(ErrorCode.INTERNAL_SERVER_ERROR.getKind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(ErrorCode.INTERNAL_SERVER_ERROR.isRetryable()).isFalse();
    }

    @Test
    @DisplayName("재시도 가능한 코드는 대행사 오류와 락 경합뿐")
    void retryable_코드목록() {
        Set<ErrorCode> retryable = EnumSet.of(
            ErrorCode.GATEWAY_ERROR, ErrorCode.GATEWAY_TIMEOUT, ErrorCode.CONCURRENT_REQUEST);

        for (ErrorCode errorCode : ErrorCode.values()) {
            assertThat(errorCode.isRetryable())
                .as(errorCode.name())
                .isEqualTo(retryable.contains(errorCode));
        }
    }
}
