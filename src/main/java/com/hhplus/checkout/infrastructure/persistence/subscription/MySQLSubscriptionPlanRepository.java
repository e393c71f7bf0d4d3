package com.hhplus.checkout.infrastructure.persistence.subscription;

import com.hhplus.checkout.domain.subscription.SubscriptionPlan;
import com.hhplus.checkout.domain.subscription.SubscriptionPlanRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public class MySQLSubscriptionPlanRepository implements SubscriptionPlanRepository {

    private final SubscriptionPlanJpaRepository subscriptionPlanJpaRepository;

    public MySQLSubscriptionPlanRepository(SubscriptionPlanJpaRepository subscriptionPlanJpaRepository) {
        this.subscriptionPlanJpaRepository = subscriptionPlanJpaRepository;
    }

    @Override
    public Optional<SubscriptionPlan> findById(String planId) {
        return subscriptionPlanJpaRepository.findById(planId);
    }

    @Override
    public Optional<SubscriptionPlan> findByPriceId(String priceId) {
        if (priceId == null || priceId.isBlank()) {
            return Optional.empty();
        }
        return subscriptionPlanJpaRepository.findByPriceId(priceId);
    }

    @Override
    public List<SubscriptionPlan> findActive() {
        return subscriptionPlanJpaRepository.findByActiveTrueOrderByPlanIdAsc();
    }

    @Override
    public SubscriptionPlan save(SubscriptionPlan plan) {
        return subscriptionPlanJpaRepository.save(plan);
    }
}
