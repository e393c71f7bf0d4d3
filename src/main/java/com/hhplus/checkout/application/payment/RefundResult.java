package com.hhplus.checkout.application.payment;

import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentStatus;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class RefundResult {
    private final Long orderId;
    private final Long paymentId;
    private final String externalRefundId;
    private final Money refundedNow;
    private final Money totalRefunded;
    private final Money remaining;
    private final boolean fullRefund;
    private final PaymentStatus paymentStatus;
    private final OrderStatus orderStatus;

    public static RefundResult of(Order order, Payment payment, String externalRefundId, Money refundedNow) {
        return RefundResult.builder()
                .orderId(order.getOrderId())
                .paymentId(payment.getPaymentId())
                .externalRefundId(externalRefundId)
                .refundedNow(refundedNow)
                .totalRefunded(payment.getRefundedAmount())
                .remaining(payment.getRemainingRefundable())
                .fullRefund(payment.getStatus() == PaymentStatus.REFUNDED)
                .paymentStatus(payment.getStatus())
                .orderStatus(order.getStatus())
                .build();
    }
}
