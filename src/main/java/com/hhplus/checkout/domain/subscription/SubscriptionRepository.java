package com.hhplus.checkout.domain.subscription;

import java.util.Optional;

public interface SubscriptionRepository {

    Subscription save(Subscription subscription);

    Optional<Subscription> findByUserId(Long userId);

    Optional<Subscription> findByExternalSubscriptionId(String externalSubscriptionId);

    Optional<Subscription> findByExternalCustomerId(String externalCustomerId);
}
