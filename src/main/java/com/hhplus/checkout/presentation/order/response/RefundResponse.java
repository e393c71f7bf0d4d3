package com.hhplus.checkout.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.payment.RefundResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 환불 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefundResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("refund_id")
    private String refundId;

    private String amount;

    @JsonProperty("total_refunded")
    private String totalRefunded;

    private String remaining;

    private String currency;

    @JsonProperty("full_refund")
    private boolean fullRefund;

    @JsonProperty("payment_status")
    private String paymentStatus;

    @JsonProperty("order_status")
    private String orderStatus;

    public static RefundResponse from(RefundResult result) {
        return RefundResponse.builder()
                .orderId(result.getOrderId())
                .refundId(result.getExternalRefundId())
                .amount(result.getRefundedNow().toDecimalString())
                .totalRefunded(result.getTotalRefunded().toDecimalString())
                .remaining(result.getRemaining().toDecimalString())
                .currency(result.getTotalRefunded().getCurrency())
                .fullRefund(result.isFullRefund())
                .paymentStatus(result.getPaymentStatus().name())
                .orderStatus(result.getOrderStatus().name())
                .build();
    }
}
