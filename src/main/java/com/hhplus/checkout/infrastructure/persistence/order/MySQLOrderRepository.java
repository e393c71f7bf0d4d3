package com.hhplus.checkout.infrastructure.persistence.order;

import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findByIdWithItems(orderId);
    }

    @Override
    @Transactional
    public Optional<Order> findByIdForUpdate(Long orderId) {
        // 잠금은 호출한 트랜잭션이 끝날 때 해제됨
        return orderJpaRepository.findByIdForUpdate(orderId);
    }

    @Override
    public void delete(Order order) {
        orderJpaRepository.delete(order);
    }
}
