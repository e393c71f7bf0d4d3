package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Payment JPA Repository
 */
public interface PaymentJpaRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByOrderId(Long orderId);

    Optional<Payment> findByChargeIntentId(String chargeIntentId);

    @Query("SELECT p.paymentId FROM Payment p WHERE p.chargeIntentId = :chargeIntentId")
    Optional<Long> findIdByChargeIntentId(@Param("chargeIntentId") String chargeIntentId);

    @Query("SELECT p.paymentId FROM Payment p WHERE p.chargeId = :chargeId ORDER BY p.paymentId DESC")
    List<Long> findIdsByChargeId(@Param("chargeId") String chargeId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.paymentId = :paymentId")
    Optional<Payment> findByIdForUpdate(@Param("paymentId") Long paymentId);

    @Query("SELECT p FROM Payment p " +
           "WHERE p.status = :status AND p.chargeIntentId IS NULL AND p.createdAt < :threshold " +
           "ORDER BY p.paymentId ASC")
    List<Payment> findByStatusWithoutIntentCreatedBefore(@Param("status") PaymentStatus status,
                                                         @Param("threshold") LocalDateTime threshold);
}
