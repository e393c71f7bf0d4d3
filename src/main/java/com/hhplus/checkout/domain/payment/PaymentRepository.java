package com.hhplus.checkout.domain.payment;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * PaymentRepository - Domain 계층 (Port)
 */
public interface PaymentRepository {

    Payment save(Payment payment);

    Optional<Payment> findById(Long paymentId);

    Optional<Payment> findByOrderId(Long orderId);

    Optional<Payment> findByChargeIntentId(String chargeIntentId);

    /**
     * 잠그기 전에 결제 ID만 찾습니다. 엔티티를 영속성 컨텍스트에 올리지 않으므로
     * 이어지는 findByIdForUpdate가 잠금과 함께 최신 행을 읽습니다.
     */
    Optional<Long> findIdByChargeIntentId(String chargeIntentId);

    Optional<Long> findIdByChargeId(String chargeId);

    /**
     * 비관적 락(SELECT ... FOR UPDATE)으로 조회 - 환불 반영용
     */
    Optional<Payment> findByIdForUpdate(Long paymentId);

    void delete(Payment payment);

    /**
     * charge intent가 붙지 않은 채 오래 남은 PENDING 결제
     */
    List<Payment> findPendingWithoutIntentCreatedBefore(LocalDateTime threshold);
}
