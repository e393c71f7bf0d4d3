package com.hhplus.checkout.domain.subscription;

import jakarta.persistence.*;
import lombok.*;

/**
 * 구독 플랜
 *
 * plan_id는 "pro"처럼 사람이 읽을 수 있는 식별자이며,
 * 월/연 결제 가격 ID는 프로세서에 등록된 가격과 매칭됩니다.
 */
@Entity
@Table(name = "subscription_plans")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionPlan {
    @Id
    @Column(name = "plan_id", length = 64)
    private String planId;

    @Column(name = "slug", nullable = false, unique = true, length = 64)
    private String slug;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "monthly_price_id", unique = true, length = 128)
    private String monthlyPriceId;

    @Column(name = "yearly_price_id", unique = true, length = 128)
    private String yearlyPriceId;

    @Column(name = "active", nullable = false)
    private boolean active;

    public String priceIdFor(BillingCycle cycle) {
        return cycle == BillingCycle.YEARLY ? yearlyPriceId : monthlyPriceId;
    }

    public boolean hasPriceId(String priceId) {
        return priceId != null && (priceId.equals(monthlyPriceId) || priceId.equals(yearlyPriceId));
    }
}
