package com.hhplus.checkout.presentation.subscription.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.subscription.dto.SubscriptionCheckoutResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionCheckoutResponse {

    @JsonProperty("session_id")
    private String sessionId;

    private String url;

    public static SubscriptionCheckoutResponse from(SubscriptionCheckoutResult result) {
        return new SubscriptionCheckoutResponse(result.getSessionId(), result.getUrl());
    }
}
