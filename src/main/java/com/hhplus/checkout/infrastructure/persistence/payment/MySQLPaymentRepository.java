package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentRepository;
import com.hhplus.checkout.domain.payment.PaymentStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Payment Repository 구현
 */
@Repository
@Primary
public class MySQLPaymentRepository implements PaymentRepository {

    private final PaymentJpaRepository paymentJpaRepository;

    public MySQLPaymentRepository(PaymentJpaRepository paymentJpaRepository) {
        this.paymentJpaRepository = paymentJpaRepository;
    }

    @Override
    public Payment save(Payment payment) {
        return paymentJpaRepository.save(payment);
    }

    @Override
    public Optional<Payment> findById(Long paymentId) {
        return paymentJpaRepository.findById(paymentId);
    }

    @Override
    public Optional<Payment> findByOrderId(Long orderId) {
        return paymentJpaRepository.findByOrderId(orderId);
    }

    @Override
    public Optional<Payment> findByChargeIntentId(String chargeIntentId) {
        return paymentJpaRepository.findByChargeIntentId(chargeIntentId);
    }

    @Override
    public Optional<Long> findIdByChargeIntentId(String chargeIntentId) {
        return paymentJpaRepository.findIdByChargeIntentId(chargeIntentId);
    }

    @Override
    public Optional<Long> findIdByChargeId(String chargeId) {
        return paymentJpaRepository.findIdsByChargeId(chargeId).stream().findFirst();
    }

    @Override
    @Transactional
    public Optional<Payment> findByIdForUpdate(Long paymentId) {
        return paymentJpaRepository.findByIdForUpdate(paymentId);
    }

    @Override
    public void delete(Payment payment) {
        paymentJpaRepository.delete(payment);
    }

    @Override
    public List<Payment> findPendingWithoutIntentCreatedBefore(LocalDateTime threshold) {
        return paymentJpaRepository.findByStatusWithoutIntentCreatedBefore(PaymentStatus.PENDING, threshold);
    }
}
