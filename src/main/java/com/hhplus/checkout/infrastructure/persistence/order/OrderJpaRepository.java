package com.hhplus.checkout.infrastructure.persistence.order;

import com.hhplus.checkout.domain.order.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Order JPA Repository
 *
 * Order.orderItems는 LAZY이므로 단건 조회는 fetch join으로 항목을 함께 로드합니다.
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    @Query("SELECT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems oi " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithItems(@Param("orderId") Long orderId);

    /**
     * 주문 ID로 조회 (비관적 락 - SELECT ... FOR UPDATE)
     *
     * 결제 이벤트 반영, 환불, 관리자 상태 변경이 같은 주문을 동시에 바꾸지 않도록 직렬화합니다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems oi " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdForUpdate(@Param("orderId") Long orderId);
}
