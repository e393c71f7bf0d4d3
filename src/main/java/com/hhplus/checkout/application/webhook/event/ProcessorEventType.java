package com.hhplus.checkout.application.webhook.event;

/**
 * 처리 대상 프로세서 이벤트 유형 (닫힌 집합)
 */
public enum ProcessorEventType {
    PAYMENT_SUCCEEDED("payment_intent.succeeded"),
    PAYMENT_FAILED("payment_intent.payment_failed"),
    CHARGE_REFUNDED("charge.refunded"),
    CHECKOUT_COMPLETED("checkout.session.completed"),
    SUBSCRIPTION_CREATED("customer.subscription.created"),
    SUBSCRIPTION_UPDATED("customer.subscription.updated"),
    SUBSCRIPTION_DELETED("customer.subscription.deleted"),
    INVOICE_PAYMENT_FAILED("invoice.payment_failed"),
    UNSUPPORTED(null);

    private final String wireName;

    ProcessorEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ProcessorEventType fromWireName(String type) {
        for (ProcessorEventType value : values()) {
            if (value.wireName != null && value.wireName.equals(type)) {
                return value;
            }
        }
        return UNSUPPORTED;
    }
}
