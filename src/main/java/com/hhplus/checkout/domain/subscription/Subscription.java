package com.hhplus.checkout.domain.subscription;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Subscription 도메인 엔티티
 *
 * 사용자당 1건이며, 취소되어도 삭제하지 않고 CANCELED로 남깁니다.
 */
@Entity
@Table(name = "subscriptions")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "subscription_id")
    private Long subscriptionId;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    @Column(name = "plan_id", nullable = false, length = 64)
    private String planId;

    @Column(name = "status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private SubscriptionStatus status;

    @Column(name = "billing_cycle", nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private BillingCycle billingCycle;

    @Column(name = "external_subscription_id", unique = true, length = 128)
    private String externalSubscriptionId;

    @Column(name = "external_customer_id", length = 128)
    private String externalCustomerId;

    @Column(name = "current_period_start")
    private LocalDateTime currentPeriodStart;

    @Column(name = "current_period_end")
    private LocalDateTime currentPeriodEnd;

    @Column(name = "cancel_at_period_end", nullable = false)
    private boolean cancelAtPeriodEnd;

    @Column(name = "canceled_at")
    private LocalDateTime canceledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Subscription start(Long userId) {
        LocalDateTime now = LocalDateTime.now();
        return Subscription.builder()
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 프로세서가 알려준 최신 상태로 덮어씁니다.
     * 재구독으로 CANCELED가 아닌 상태가 되면 취소 시각을 지웁니다.
     */
    public void sync(String planId, SubscriptionStatus status, BillingCycle billingCycle,
                     String externalSubscriptionId, String externalCustomerId,
                     LocalDateTime periodStart, LocalDateTime periodEnd, boolean cancelAtPeriodEnd) {
        this.planId = planId;
        this.status = status;
        this.billingCycle = billingCycle;
        this.externalSubscriptionId = externalSubscriptionId;
        if (externalCustomerId != null) {
            this.externalCustomerId = externalCustomerId;
        }
        if (periodStart != null) {
            this.currentPeriodStart = periodStart;
        }
        if (periodEnd != null) {
            this.currentPeriodEnd = periodEnd;
        }
        this.cancelAtPeriodEnd = cancelAtPeriodEnd;
        if (status != SubscriptionStatus.CANCELED) {
            this.canceledAt = null;
        }
        this.updatedAt = LocalDateTime.now();
    }

    public void cancel(LocalDateTime canceledAt) {
        this.status = SubscriptionStatus.CANCELED;
        this.canceledAt = canceledAt;
        this.cancelAtPeriodEnd = false;
        this.updatedAt = LocalDateTime.now();
    }

    public void markPastDue() {
        this.status = SubscriptionStatus.PAST_DUE;
        this.updatedAt = LocalDateTime.now();
    }
}
