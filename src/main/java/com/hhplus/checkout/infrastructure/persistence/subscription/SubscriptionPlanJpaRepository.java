package com.hhplus.checkout.infrastructure.persistence.subscription;

import com.hhplus.checkout.domain.subscription.SubscriptionPlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface SubscriptionPlanJpaRepository extends JpaRepository<SubscriptionPlan, String> {

    @Query("SELECT p FROM SubscriptionPlan p " +
           "WHERE p.monthlyPriceId = :priceId OR p.yearlyPriceId = :priceId")
    Optional<SubscriptionPlan> findByPriceId(@Param("priceId") String priceId);

    List<SubscriptionPlan> findByActiveTrueOrderByPlanIdAsc();
}
