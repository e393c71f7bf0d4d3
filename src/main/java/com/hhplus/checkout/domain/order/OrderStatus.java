package com.hhplus.checkout.domain.order;

/**
 * 주문 상태
 *
 * PENDING → CONFIRMED → SHIPPED → DELIVERED
 * PENDING/CONFIRMED → CANCELLED (관리자)
 * CONFIRMED/SHIPPED/DELIVERED → REFUNDED (전액 환불)
 *
 * 부분 환불은 주문 상태를 바꾸지 않고 Order.paymentStatus로만 표시합니다.
 * PARTIALLY_REFUNDED는 외부 연동 호환을 위해 값만 유지합니다.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    SHIPPED,
    DELIVERED,
    CANCELLED,
    REFUNDED,
    PARTIALLY_REFUNDED
}
