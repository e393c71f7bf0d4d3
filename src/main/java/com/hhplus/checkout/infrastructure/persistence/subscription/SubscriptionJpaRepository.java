package com.hhplus.checkout.infrastructure.persistence.subscription;

import com.hhplus.checkout.domain.subscription.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SubscriptionJpaRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByUserId(Long userId);

    Optional<Subscription> findByExternalSubscriptionId(String externalSubscriptionId);

    Optional<Subscription> findFirstByExternalCustomerIdOrderByUpdatedAtDesc(String externalCustomerId);
}
