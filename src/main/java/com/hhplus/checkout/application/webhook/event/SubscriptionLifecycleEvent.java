package com.hhplus.checkout.application.webhook.event;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * checkout.session.completed(구독 모드) / customer.subscription.created|updated|deleted
 *
 * 플랜 해석에 쓰이는 세 가지 단서(메타데이터 planId, 가격 ID, 상품명)를 모두 담습니다.
 */
@Getter
public class SubscriptionLifecycleEvent extends ProcessorEvent {

    private final ProcessorEventType type;
    private final String externalSubscriptionId;
    private final String externalCustomerId;
    private final String status;
    private final LocalDateTime currentPeriodStart;
    private final LocalDateTime currentPeriodEnd;
    private final boolean cancelAtPeriodEnd;
    private final Long metadataUserId;
    private final String metadataPlanId;
    private final String metadataBillingCycle;
    private final String priceId;
    private final String productName;
    private final String interval;

    @Builder
    public SubscriptionLifecycleEvent(String eventId, String rawType, Instant createdAt, ProcessorEventType type,
                                      String externalSubscriptionId, String externalCustomerId, String status,
                                      LocalDateTime currentPeriodStart, LocalDateTime currentPeriodEnd,
                                      boolean cancelAtPeriodEnd, Long metadataUserId, String metadataPlanId,
                                      String metadataBillingCycle, String priceId, String productName,
                                      String interval) {
        super(eventId, rawType, createdAt);
        this.type = type;
        this.externalSubscriptionId = externalSubscriptionId;
        this.externalCustomerId = externalCustomerId;
        this.status = status;
        this.currentPeriodStart = currentPeriodStart;
        this.currentPeriodEnd = currentPeriodEnd;
        this.cancelAtPeriodEnd = cancelAtPeriodEnd;
        this.metadataUserId = metadataUserId;
        this.metadataPlanId = metadataPlanId;
        this.metadataBillingCycle = metadataBillingCycle;
        this.priceId = priceId;
        this.productName = productName;
        this.interval = interval;
    }

    public boolean isDeletion() {
        return type == ProcessorEventType.SUBSCRIPTION_DELETED;
    }
}
