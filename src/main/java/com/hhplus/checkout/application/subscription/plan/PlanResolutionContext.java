package com.hhplus.checkout.application.subscription.plan;

import com.hhplus.checkout.application.webhook.event.SubscriptionLifecycleEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 플랜 해석 단서: 메타데이터 planId, 가격 ID, 청구 상품명
 */
@Getter
@ToString
@AllArgsConstructor
public class PlanResolutionContext {
    private final String metadataPlanId;
    private final String priceId;
    private final String productName;

    public static PlanResolutionContext from(SubscriptionLifecycleEvent event) {
        return new PlanResolutionContext(event.getMetadataPlanId(), event.getPriceId(), event.getProductName());
    }
}
