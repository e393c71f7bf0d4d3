package com.hhplus.checkout.domain.subscription;

import java.util.List;
import java.util.Optional;

public interface SubscriptionPlanRepository {

    Optional<SubscriptionPlan> findById(String planId);

    Optional<SubscriptionPlan> findByPriceId(String priceId);

    List<SubscriptionPlan> findActive();

    SubscriptionPlan save(SubscriptionPlan plan);
}
