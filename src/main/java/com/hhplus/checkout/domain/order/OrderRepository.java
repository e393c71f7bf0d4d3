package com.hhplus.checkout.domain.order;

import java.util.Optional;

/**
 * OrderRepository - Domain 계층 (Port)
 */
public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 비관적 락(SELECT ... FOR UPDATE)으로 조회
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    void delete(Order order);
}
