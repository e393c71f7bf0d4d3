package com.hhplus.checkout.application.subscription.plan;

import com.hhplus.checkout.domain.subscription.SubscriptionPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 플랜 해석 체인 (메타데이터 → 가격 ID → 상품명)
 */
@Slf4j
@Component
public class PlanResolutionChain {

    private final List<PlanResolver> resolvers;

    public PlanResolutionChain(List<PlanResolver> resolvers) {
        this.resolvers = List.copyOf(resolvers);
    }

    public Optional<SubscriptionPlan> resolve(PlanResolutionContext context) {
        for (PlanResolver resolver : resolvers) {
            Optional<SubscriptionPlan> plan = resolver.resolve(context);
            if (plan.isPresent()) {
                log.info("[PlanResolutionChain] 플랜 해석 - resolver={}, planId={}", resolver.name(), plan.get().getPlanId());
                return plan;
            }
        }
        log.warn("[PlanResolutionChain] 플랜 해석 실패 - context={}", context);
        return Optional.empty();
    }
}
