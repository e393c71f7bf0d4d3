package com.hhplus.checkout.presentation.subscription.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.subscription.dto.SubscriptionView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 내 구독 조회 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubscriptionResponse {

    @JsonProperty("subscription_id")
    private Long subscriptionId;

    @JsonProperty("plan_id")
    private String planId;

    private String status;

    @JsonProperty("billing_cycle")
    private String billingCycle;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("current_period_start")
    private LocalDateTime currentPeriodStart;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("current_period_end")
    private LocalDateTime currentPeriodEnd;

    @JsonProperty("cancel_at_period_end")
    private boolean cancelAtPeriodEnd;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("canceled_at")
    private LocalDateTime canceledAt;

    public static SubscriptionResponse from(SubscriptionView view) {
        return SubscriptionResponse.builder()
                .subscriptionId(view.getSubscriptionId())
                .planId(view.getPlanId())
                .status(view.getStatus().getExternalValue())
                .billingCycle(view.getBillingCycle().name())
                .currentPeriodStart(view.getCurrentPeriodStart())
                .currentPeriodEnd(view.getCurrentPeriodEnd())
                .cancelAtPeriodEnd(view.isCancelAtPeriodEnd())
                .canceledAt(view.getCanceledAt())
                .build();
    }
}
