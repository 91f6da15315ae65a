package io.hhplus.checkout.domain.payment;

/**
 * 결제 대행사 PaymentIntent 상태의 로컬 미러
 */
public enum PaymentIntentStatus {
    REQUIRES_ACTION,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this != REQUIRES_ACTION;
    }
}
