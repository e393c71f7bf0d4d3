package com.hhplus.checkout.domain.payment;

import java.util.List;

public interface RefundRepository {

    Refund save(Refund refund);

    boolean existsByExternalRefundId(String externalRefundId);

    List<Refund> findByPaymentId(Long paymentId);
}
