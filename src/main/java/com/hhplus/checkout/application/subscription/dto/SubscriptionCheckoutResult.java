package com.hhplus.checkout.application.subscription.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SubscriptionCheckoutResult {
    private final String sessionId;
    private final String url;
}
