package com.hhplus.checkout.infrastructure.persistence.subscription;

import com.hhplus.checkout.domain.subscription.Subscription;
import com.hhplus.checkout.domain.subscription.SubscriptionRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 Subscription Repository 구현
 *
 * 사용자당 구독 한 건 (user_id 유니크)
 */
@Repository
@Primary
public class MySQLSubscriptionRepository implements SubscriptionRepository {

    private final SubscriptionJpaRepository subscriptionJpaRepository;

    public MySQLSubscriptionRepository(SubscriptionJpaRepository subscriptionJpaRepository) {
        this.subscriptionJpaRepository = subscriptionJpaRepository;
    }

    @Override
    public Subscription save(Subscription subscription) {
        return subscriptionJpaRepository.save(subscription);
    }

    @Override
    public Optional<Subscription> findByUserId(Long userId) {
        return subscriptionJpaRepository.findByUserId(userId);
    }

    @Override
    public Optional<Subscription> findByExternalSubscriptionId(String externalSubscriptionId) {
        return subscriptionJpaRepository.findByExternalSubscriptionId(externalSubscriptionId);
    }

    @Override
    public Optional<Subscription> findByExternalCustomerId(String externalCustomerId) {
        return subscriptionJpaRepository.findFirstByExternalCustomerIdOrderByUpdatedAtDesc(externalCustomerId);
    }
}
