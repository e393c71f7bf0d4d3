package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.Refund;
import com.hhplus.checkout.domain.payment.RefundRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@Primary
public class MySQLRefundRepository implements RefundRepository {

    private final RefundJpaRepository refundJpaRepository;

    public MySQLRefundRepository(RefundJpaRepository refundJpaRepository) {
        this.refundJpaRepository = refundJpaRepository;
    }

    @Override
    public Refund save(Refund refund) {
        return refundJpaRepository.save(refund);
    }

    @Override
    public boolean existsByExternalRefundId(String externalRefundId) {
        return externalRefundId != null && refundJpaRepository.existsByExternalRefundId(externalRefundId);
    }

    @Override
    public List<Refund> findByPaymentId(Long paymentId) {
        return refundJpaRepository.findByPaymentIdOrderByRefundIdAsc(paymentId);
    }
}
