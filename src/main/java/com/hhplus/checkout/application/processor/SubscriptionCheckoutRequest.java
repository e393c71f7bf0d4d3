package com.hhplus.checkout.application.processor;

import com.hhplus.checkout.domain.subscription.BillingCycle;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class SubscriptionCheckoutRequest {
    private final String priceId;
    private final Long userId;
    private final String planId;
    private final BillingCycle billingCycle;
    private final String customerEmail;
    private final String successUrl;
    private final String cancelUrl;
    private final String idempotencyKey;
}
