package io.hhplus.checkout.domain.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum RefundReason {
    DUPLICATE("duplicate"),
    FRAUDULENT("fraudulent"),
    REQUESTED_BY_CUSTOMER("requested_by_customer");

    @JsonValue
    private final String value;

    @JsonCreator
    public static RefundReason from(String value) {
        if (value == null) {
            return REQUESTED_BY_CUSTOMER;
        }
        return Arrays.stream(values())
            .filter(reason -> reason.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new BusinessException(
                ErrorCode.INVALID_INPUT,
                "지원하지 않는 환불 사유입니다: " + value
            ));
    }
}
