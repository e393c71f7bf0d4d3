package com.hhplus.checkout.application.subscription.plan;

import com.hhplus.checkout.domain.subscription.SubscriptionPlan;
import com.hhplus.checkout.domain.subscription.SubscriptionPlanRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 1순위: 체크아웃 시 메타데이터에 실어 보낸 planId
 */
@Component
@Order(1)
public class MetadataPlanResolver implements PlanResolver {

    private final SubscriptionPlanRepository planRepository;

    public MetadataPlanResolver(SubscriptionPlanRepository planRepository) {
        this.planRepository = planRepository;
    }

    @Override
    public Optional<SubscriptionPlan> resolve(PlanResolutionContext context) {
        if (context.getMetadataPlanId() == null) {
            return Optional.empty();
        }
        return planRepository.findById(context.getMetadataPlanId());
    }

    @Override
    public String name() {
        return "metadata";
    }
}
