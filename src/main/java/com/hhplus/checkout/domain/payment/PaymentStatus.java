package com.hhplus.checkout.domain.payment;

/**
 * 결제 상태
 *
 * PENDING → PAID → {PARTIALLY_REFUNDED → REFUNDED | REFUNDED}
 * PENDING → FAILED (해당 결제 시도의 종료 상태)
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    PARTIALLY_REFUNDED,
    REFUNDED;

    public boolean isRefundable() {
        return this == PAID || this == PARTIALLY_REFUNDED;
    }
}
