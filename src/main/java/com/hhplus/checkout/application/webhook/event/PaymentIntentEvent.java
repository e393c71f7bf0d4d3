package com.hhplus.checkout.application.webhook.event;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * payment_intent.succeeded / payment_intent.payment_failed
 */
@Getter
public class PaymentIntentEvent extends ProcessorEvent {

    private final ProcessorEventType type;
    private final String chargeIntentId;
    private final long amountMinor;
    private final String currency;
    private final String chargeId;
    private final Long orderId;
    private final String failureMessage;

    @Builder
    public PaymentIntentEvent(String eventId, String rawType, Instant createdAt, boolean succeeded,
                              String chargeIntentId, long amountMinor, String currency, String chargeId,
                              Long orderId, String failureMessage) {
        super(eventId, rawType, createdAt);
        this.type = succeeded ? ProcessorEventType.PAYMENT_SUCCEEDED : ProcessorEventType.PAYMENT_FAILED;
        this.chargeIntentId = chargeIntentId;
        this.amountMinor = amountMinor;
        this.currency = currency;
        this.chargeId = chargeId;
        this.orderId = orderId;
        this.failureMessage = failureMessage;
    }

    public boolean isSucceeded() {
        return type == ProcessorEventType.PAYMENT_SUCCEEDED;
    }
}
