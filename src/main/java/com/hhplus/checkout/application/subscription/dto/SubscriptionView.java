package com.hhplus.checkout.application.subscription.dto;

import com.hhplus.checkout.domain.subscription.BillingCycle;
import com.hhplus.checkout.domain.subscription.Subscription;
import com.hhplus.checkout.domain.subscription.SubscriptionStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
public class SubscriptionView {
    private final Long subscriptionId;
    private final String planId;
    private final SubscriptionStatus status;
    private final BillingCycle billingCycle;
    private final LocalDateTime currentPeriodStart;
    private final LocalDateTime currentPeriodEnd;
    private final boolean cancelAtPeriodEnd;
    private final LocalDateTime canceledAt;

    public static SubscriptionView from(Subscription subscription) {
        return SubscriptionView.builder()
                .subscriptionId(subscription.getSubscriptionId())
                .planId(subscription.getPlanId())
                .status(subscription.getStatus())
                .billingCycle(subscription.getBillingCycle())
                .currentPeriodStart(subscription.getCurrentPeriodStart())
                .currentPeriodEnd(subscription.getCurrentPeriodEnd())
                .cancelAtPeriodEnd(subscription.isCancelAtPeriodEnd())
                .canceledAt(subscription.getCanceledAt())
                .build();
    }
}
