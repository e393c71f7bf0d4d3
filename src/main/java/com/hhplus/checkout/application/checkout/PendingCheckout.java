package com.hhplus.checkout.application.checkout;

import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.payment.Payment;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 프로세서 호출 전 커밋된 PENDING 주문과 결제
 */
@Getter
@AllArgsConstructor
public class PendingCheckout {
    private final Order order;
    private final Payment payment;
}
