package io.hhplus.checkout.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 * 코드마다 ErrorKind를 가지며, 응답 매핑은 ErrorKind 기준으로 한다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 상품/재고 관련 (P)
    // ====================================
    PRODUCT_NOT_FOUND("P001", ErrorKind.NOT_FOUND, "상품을 찾을 수 없습니다"),
    INSUFFICIENT_STOCK("P002", ErrorKind.INSUFFICIENT_STOCK, "재고가 부족합니다"),
    PRODUCT_UNAVAILABLE("P003", ErrorKind.ITEM_UNAVAILABLE, "판매 중지된 상품입니다"),
    INVALID_QUANTITY("P004", ErrorKind.VALIDATION_FAILED, "수량은 1 이상이어야 합니다"),

    // ====================================
    // 장바구니 관련 (CART)
    // ====================================
    CART_ITEM_NOT_FOUND("CART001", ErrorKind.NOT_FOUND, "장바구니 상품을 찾을 수 없습니다"),
    CART_EMPTY("CART002", ErrorKind.VALIDATION_FAILED, "장바구니가 비어 있습니다"),
    CART_ITEM_QUANTITY_EXCEEDED("CART003", ErrorKind.VALIDATION_FAILED, "상품당 최대 수량을 초과했습니다"),

    // ====================================
    // 주문 관련 (O)
    // ====================================
    ORDER_NOT_FOUND("O001", ErrorKind.NOT_FOUND, "주문을 찾을 수 없습니다"),
    INVALID_ORDER_STATUS_TRANSITION("O002", ErrorKind.INVALID_STATE, "허용되지 않는 주문 상태 변경입니다"),
    ORDER_NOT_CANCELLABLE("O003", ErrorKind.INVALID_STATE, "취소할 수 없는 주문입니다"),

    // ====================================
    // 결제 관련 (PAY)
    // ====================================
    ALREADY_PAID("PAY001", ErrorKind.INVALID_STATE, "이미 결제된 주문입니다"),
    ORDER_CANCELLED("PAY002", ErrorKind.INVALID_STATE, "취소된 주문은 결제할 수 없습니다"),
    PAYMENT_NOT_ALLOWED("PAY003", ErrorKind.INVALID_STATE, "결제를 진행할 수 없는 주문 상태입니다"),
    PAYMENT_INTENT_NOT_FOUND("PAY004", ErrorKind.NOT_FOUND, "결제 요청을 찾을 수 없습니다"),
    NOT_PAID("PAY005", ErrorKind.INVALID_STATE, "결제 완료 상태가 아닌 주문입니다"),
    NO_PAYMENT_INTENT("PAY006", ErrorKind.NOT_FOUND, "주문에 연결된 결제 요청이 없습니다"),
    REFUND_AMOUNT_EXCEEDS_CAPTURED("PAY007", ErrorKind.VALIDATION_FAILED, "환불 금액이 환불 가능 금액을 초과했습니다"),
    INVALID_PAYMENT_AMOUNT("PAY008", ErrorKind.VALIDATION_FAILED, "결제/환불 금액이 올바르지 않습니다"),
    INVALID_PAYMENT_STATUS_TRANSITION("PAY009", ErrorKind.INVALID_STATE, "허용되지 않는 결제 상태 변경입니다"),
    PAYMENT_INTENT_ALREADY_EXISTS("PAY010", ErrorKind.ALREADY_EXISTS, "이미 결제 요청이 존재합니다"),
    PAYMENT_INTENT_NOT_CONFIRMABLE("PAY011", ErrorKind.INVALID_STATE, "승인할 수 없는 결제 요청 상태입니다"),

    // ====================================
    // 결제 대행사 관련 (GW)
    // ====================================
    GATEWAY_ERROR("GW001", ErrorKind.GATEWAY_ERROR, "결제 대행사 호출에 실패했습니다"),
    GATEWAY_TIMEOUT("GW002", ErrorKind.GATEWAY_ERROR, "결제 대행사 응답 시간이 초과되었습니다. 결제 상태를 조회한 뒤 재시도하세요"),

    // ====================================
    // 웹훅 관련 (WH)
    // ====================================
    SIGNATURE_MISSING("WH001", ErrorKind.SIGNATURE_INVALID, "서명 헤더가 없습니다"),
    SIGNATURE_INVALID("WH002", ErrorKind.SIGNATURE_INVALID, "웹훅 서명이 올바르지 않습니다"),
    WEBHOOK_PAYLOAD_INVALID("WH003", ErrorKind.VALIDATION_FAILED, "웹훅 본문을 해석할 수 없습니다"),
    FAILED_EVENT_NOT_FOUND("WH004", ErrorKind.NOT_FOUND, "실패 이벤트를 찾을 수 없습니다"),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", ErrorKind.INTERNAL, "서버 내부 오류가 발생했습니다"),
    INVALID_INPUT("COMMON002", ErrorKind.VALIDATION_FAILED, "입력값이 올바르지 않습니다"),
    CONCURRENT_REQUEST("COMMON003", ErrorKind.CONCURRENCY_CONFLICT, "동일한 요청이 처리 중입니다. 잠시 후 다시 시도해주세요");

    private final String code;
    private final ErrorKind kind;
    private final String message;

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
