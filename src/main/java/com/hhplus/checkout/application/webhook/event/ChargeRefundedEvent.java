package com.hhplus.checkout.application.webhook.event;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * charge.refunded
 *
 * amountRefundedMinor는 이번 환불 금액이 아니라 해당 결제의 누적 환불액입니다.
 */
@Getter
public class ChargeRefundedEvent extends ProcessorEvent {

    private final String chargeId;
    private final String chargeIntentId;
    private final long amountMinor;
    private final long amountRefundedMinor;
    private final String currency;
    private final boolean fullyRefunded;
    private final String latestRefundId;

    @Builder
    public ChargeRefundedEvent(String eventId, String rawType, Instant createdAt, String chargeId,
                               String chargeIntentId, long amountMinor, long amountRefundedMinor,
                               String currency, boolean fullyRefunded, String latestRefundId) {
        super(eventId, rawType, createdAt);
        this.chargeId = chargeId;
        this.chargeIntentId = chargeIntentId;
        this.amountMinor = amountMinor;
        this.amountRefundedMinor = amountRefundedMinor;
        this.currency = currency;
        this.fullyRefunded = fullyRefunded;
        this.latestRefundId = latestRefundId;
    }

    @Override
    public ProcessorEventType getType() {
        return ProcessorEventType.CHARGE_REFUNDED;
    }
}
