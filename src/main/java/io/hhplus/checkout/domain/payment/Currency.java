package io.hhplus.checkout.domain.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * 결제 통화 (결제 대행사에는 소문자 코드로 전달)
 */
@Getter
@RequiredArgsConstructor
public enum Currency {
    USD("usd"),
    EUR("eur"),
    GBP("gbp"),
    BDT("bdt");

    @JsonValue
    private final String code;

    @JsonCreator
    public static Currency from(String code) {
        return Arrays.stream(values())
            .filter(currency -> currency.code.equalsIgnoreCase(code))
            .findFirst()
            .orElseThrow(() -> new BusinessException(
                ErrorCode.INVALID_INPUT,
                "지원하지 않는 통화입니다: " + code
            ));
    }
}
