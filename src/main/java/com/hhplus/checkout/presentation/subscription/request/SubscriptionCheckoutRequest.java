package com.hhplus.checkout.presentation.subscription.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 구독 체크아웃 요청 DTO
 *
 * billing_cycle: MONTHLY | YEARLY (생략 시 MONTHLY)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionCheckoutRequest {

    @JsonProperty("plan_id")
    private String planId;

    @JsonProperty("billing_cycle")
    private String billingCycle;

    private String email;
}
