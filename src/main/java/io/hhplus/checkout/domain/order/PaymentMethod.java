package io.hhplus.checkout.domain.order;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * 결제 수단
 *
 * 카드 계열(credit_card, debit_card, gateway_card)은 주문 직후 결제 대행사 PaymentIntent를 생성한다.
 */
@Getter
@RequiredArgsConstructor
public enum PaymentMethod {
    CASH_ON_DELIVERY("cash_on_delivery", false),
    CREDIT_CARD("credit_card", true),
    DEBIT_CARD("debit_card", true),
    MOBILE_BANKING("mobile_banking", false),
    BANK_TRANSFER("bank_transfer", false),
    GATEWAY_CARD("gateway_card", true);

    @JsonValue
    private final String value;
    private final boolean requiresUpfrontIntent;

    @JsonCreator
    public static PaymentMethod from(String value) {
        return Arrays.stream(values())
            .filter(method -> method.value.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new BusinessException(
                ErrorCode.INVALID_INPUT,
                "지원하지 않는 결제 수단입니다: " + value
            ));
    }
}
