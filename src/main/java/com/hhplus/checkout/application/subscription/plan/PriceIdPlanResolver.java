package com.hhplus.checkout.application.subscription.plan;

import com.hhplus.checkout.domain.subscription.SubscriptionPlan;
import com.hhplus.checkout.domain.subscription.SubscriptionPlanRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 2순위: 가격 ID가 플랜의 월/연 가격 ID와 정확히 일치
 */
@Component
@Order(2)
public class PriceIdPlanResolver implements PlanResolver {

    private final SubscriptionPlanRepository planRepository;

    public PriceIdPlanResolver(SubscriptionPlanRepository planRepository) {
        this.planRepository = planRepository;
    }

    @Override
    public Optional<SubscriptionPlan> resolve(PlanResolutionContext context) {
        if (context.getPriceId() == null) {
            return Optional.empty();
        }
        return planRepository.findByPriceId(context.getPriceId());
    }

    @Override
    public String name() {
        return "price-id";
    }
}
