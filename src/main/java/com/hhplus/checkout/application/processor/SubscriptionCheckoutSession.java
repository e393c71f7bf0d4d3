package com.hhplus.checkout.application.processor;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SubscriptionCheckoutSession {
    private final String id;
    private final String url;
}
