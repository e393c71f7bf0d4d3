package com.hhplus.checkout.presentation.checkout.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.checkout.CheckoutResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 응답 DTO
 *
 * 클라이언트는 client_secret으로 프로세서 결제를 진행합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("order_number")
    private String orderNumber;

    private String status;

    private String subtotal;

    private String total;

    private String currency;

    @JsonProperty("charge_intent_id")
    private String chargeIntentId;

    @JsonProperty("client_secret")
    private String clientSecret;

    public static CheckoutResponse from(CheckoutResult result) {
        return CheckoutResponse.builder()
                .orderId(result.getOrderId())
                .orderNumber(result.getOrderNumber())
                .status(result.getStatus().name())
                .subtotal(result.getSubtotal().toDecimalString())
                .total(result.getTotal().toDecimalString())
                .currency(result.getTotal().getCurrency())
                .chargeIntentId(result.getChargeIntentId())
                .clientSecret(result.getClientSecret())
                .build();
    }
}
