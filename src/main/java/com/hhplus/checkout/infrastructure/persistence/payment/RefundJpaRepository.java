package com.hhplus.checkout.infrastructure.persistence.payment;

import com.hhplus.checkout.domain.payment.Refund;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RefundJpaRepository extends JpaRepository<Refund, Long> {

    boolean existsByExternalRefundId(String externalRefundId);

    List<Refund> findByPaymentIdOrderByRefundIdAsc(Long paymentId);
}
