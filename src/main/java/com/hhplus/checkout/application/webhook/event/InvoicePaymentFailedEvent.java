package com.hhplus.checkout.application.webhook.event;

import lombok.Getter;

import java.time.Instant;

/**
 * invoice.payment_failed
 */
@Getter
public class InvoicePaymentFailedEvent extends ProcessorEvent {

    private final String invoiceId;
    private final String externalCustomerId;
    private final String externalSubscriptionId;

    public InvoicePaymentFailedEvent(String eventId, String rawType, Instant createdAt, String invoiceId,
                                     String externalCustomerId, String externalSubscriptionId) {
        super(eventId, rawType, createdAt);
        this.invoiceId = invoiceId;
        this.externalCustomerId = externalCustomerId;
        this.externalSubscriptionId = externalSubscriptionId;
    }

    @Override
    public ProcessorEventType getType() {
        return ProcessorEventType.INVOICE_PAYMENT_FAILED;
    }
}
