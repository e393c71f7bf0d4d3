package com.hhplus.checkout.application.subscription;

import com.hhplus.checkout.application.subscription.plan.PlanResolutionChain;
import com.hhplus.checkout.application.subscription.plan.PlanResolutionContext;
import com.hhplus.checkout.application.webhook.event.InvoicePaymentFailedEvent;
import com.hhplus.checkout.application.webhook.event.ProcessorEventType;
import com.hhplus.checkout.application.webhook.event.SubscriptionLifecycleEvent;
import com.hhplus.checkout.domain.event.EventOutcome;
import com.hhplus.checkout.domain.subscription.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 구독 이벤트 처리 (Subscription 상태 머신)
 *
 * - 생성/갱신/체크아웃 완료: 사용자 기준 upsert (사용자당 1건)
 * - 삭제: CANCELED + 취소 시각, 행은 유지
 * - 청구 실패: PAST_DUE
 *
 * 사용자나 플랜을 확정할 수 없으면 반쯤 채운 구독을 만들지 않고 UNRESOLVED로 남깁니다.
 */
@Slf4j
@Component
public class SubscriptionEventHandler {

    private final SubscriptionRepository subscriptionRepository;
    private final PlanResolutionChain planResolutionChain;
    private final Clock clock;

    public SubscriptionEventHandler(SubscriptionRepository subscriptionRepository,
                                    PlanResolutionChain planResolutionChain,
                                    Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.planResolutionChain = planResolutionChain;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EventOutcome handleLifecycle(SubscriptionLifecycleEvent event) {
        Optional<Subscription> existing = subscriptionRepository
                .findByExternalSubscriptionId(event.getExternalSubscriptionId());

        if (event.isDeletion()) {
            return cancel(event, existing);
        }

        Long userId = event.getMetadataUserId();
        if (userId == null && existing.isPresent()) {
            userId = existing.get().getUserId();
        }
        if (userId == null) {
            log.warn("[SubscriptionEventHandler] 사용자를 확정할 수 없음 - eventId={}, subscriptionId={}",
                    event.getEventId(), event.getExternalSubscriptionId());
            return EventOutcome.UNRESOLVED;
        }

        Long subscriberId = userId;
        Optional<Subscription> current = subscriptionRepository.findByUserId(subscriberId);
        if (existing.isEmpty() && isSupersededUpdate(event, current)) {
            log.warn("[SubscriptionEventHandler] 현재 구독과 다른 이전 구독의 갱신 이벤트 무시 - eventId={}, subscriptionId={}, currentSubscriptionId={}",
                    event.getEventId(), event.getExternalSubscriptionId(), current.get().getExternalSubscriptionId());
            return EventOutcome.IGNORED;
        }

        String planId = planResolutionChain.resolve(PlanResolutionContext.from(event))
                .map(SubscriptionPlan::getPlanId)
                .orElse(existing.map(Subscription::getPlanId).orElse(null));
        if (planId == null) {
            log.warn("[SubscriptionEventHandler] 플랜을 확정할 수 없어 이벤트를 버림 - eventId={}, priceId={}, productName={}",
                    event.getEventId(), event.getPriceId(), event.getProductName());
            return EventOutcome.UNRESOLVED;
        }

        SubscriptionStatus status = mapStatus(event);
        BillingCycle cycle = resolveCycle(event, existing);

        Subscription subscription = current.orElseGet(() -> Subscription.start(subscriberId));
        subscription.sync(planId, status, cycle,
                event.getExternalSubscriptionId(), event.getExternalCustomerId(),
                event.getCurrentPeriodStart(), event.getCurrentPeriodEnd(), event.isCancelAtPeriodEnd());
        subscriptionRepository.save(subscription);

        log.info("[SubscriptionEventHandler] 구독 반영 - userId={}, planId={}, status={}, cycle={}, type={}",
                userId, planId, status, cycle, event.getType());
        return EventOutcome.APPLIED;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EventOutcome handleInvoiceFailed(InvoicePaymentFailedEvent event) {
        Optional<Subscription> found = Optional.empty();
        if (event.getExternalSubscriptionId() != null) {
            found = subscriptionRepository.findByExternalSubscriptionId(event.getExternalSubscriptionId());
        }
        if (found.isEmpty() && event.getExternalCustomerId() != null) {
            found = subscriptionRepository.findByExternalCustomerId(event.getExternalCustomerId());
        }
        if (found.isEmpty()) {
            log.warn("[SubscriptionEventHandler] 청구 실패 이벤트의 구독을 찾을 수 없음 - invoiceId={}", event.getInvoiceId());
            return EventOutcome.IGNORED;
        }

        Subscription subscription = found.get();
        subscription.markPastDue();
        subscriptionRepository.save(subscription);
        log.info("[SubscriptionEventHandler] 청구 실패로 PAST_DUE - userId={}, invoiceId={}",
                subscription.getUserId(), event.getInvoiceId());
        return EventOutcome.APPLIED;
    }

    private EventOutcome cancel(SubscriptionLifecycleEvent event, Optional<Subscription> existing) {
        if (existing.isEmpty()) {
            log.warn("[SubscriptionEventHandler] 삭제 이벤트의 구독을 찾을 수 없음 - subscriptionId={}",
                    event.getExternalSubscriptionId());
            return EventOutcome.IGNORED;
        }
        Subscription subscription = existing.get();
        subscription.cancel(LocalDateTime.now(clock));
        subscriptionRepository.save(subscription);
        log.info("[SubscriptionEventHandler] 구독 취소 - userId={}, subscriptionId={}",
                subscription.getUserId(), event.getExternalSubscriptionId());
        return EventOutcome.APPLIED;
    }

    /**
     * 사용자 기준 행으로 넘어가도 되는지 판단합니다.
     * 생성/체크아웃 완료는 재구독일 수 있으므로 허용하고, 갱신 이벤트는 행이 아직 외부 구독과
     * 연결되지 않았거나 CANCELED일 때만 허용합니다.
     */
    private boolean isSupersededUpdate(SubscriptionLifecycleEvent event, Optional<Subscription> current) {
        if (event.getType() != ProcessorEventType.SUBSCRIPTION_UPDATED || current.isEmpty()) {
            return false;
        }
        Subscription row = current.get();
        return row.getExternalSubscriptionId() != null
                && !row.getExternalSubscriptionId().equals(event.getExternalSubscriptionId())
                && row.getStatus() != SubscriptionStatus.CANCELED;
    }

    /**
     * 알 수 없는 상태는 ACTIVE로 간주합니다 (상태 이름 변경으로 인한 오취소 방지).
     */
    private SubscriptionStatus mapStatus(SubscriptionLifecycleEvent event) {
        return SubscriptionStatus.fromExternal(event.getStatus()).orElseGet(() -> {
            log.warn("[SubscriptionEventHandler] 알 수 없는 구독 상태, ACTIVE로 처리 - status={}, eventId={}",
                    event.getStatus(), event.getEventId());
            return SubscriptionStatus.ACTIVE;
        });
    }

    private BillingCycle resolveCycle(SubscriptionLifecycleEvent event, Optional<Subscription> existing) {
        Optional<BillingCycle> fromInterval = BillingCycle.fromInterval(event.getInterval());
        if (fromInterval.isPresent()) {
            return fromInterval.get();
        }
        if (event.getMetadataBillingCycle() != null) {
            try {
                return BillingCycle.fromString(event.getMetadataBillingCycle());
            } catch (IllegalArgumentException e) {
                log.warn("[SubscriptionEventHandler] 메타데이터 결제 주기 무시 - value={}", event.getMetadataBillingCycle());
            }
        }
        return existing.map(Subscription::getBillingCycle).orElse(BillingCycle.MONTHLY);
    }
}
