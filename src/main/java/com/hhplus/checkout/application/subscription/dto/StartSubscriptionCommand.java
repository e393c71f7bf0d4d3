package com.hhplus.checkout.application.subscription.dto;

import com.hhplus.checkout.domain.subscription.BillingCycle;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class StartSubscriptionCommand {
    private final Long userId;
    private final String email;
    private final String planId;
    private final BillingCycle billingCycle;
}
