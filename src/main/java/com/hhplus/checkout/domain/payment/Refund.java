package com.hhplus.checkout.domain.payment;

import com.hhplus.checkout.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 환불 이력
 *
 * 관리자 환불과 프로세서 환불 이벤트가 같은 환불을 두 번 반영하지 않도록
 * external_refund_id에 유니크 제약을 둡니다.
 */
@Entity
@Table(name = "refunds")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Refund {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "refund_id")
    private Long refundId;

    @Column(name = "payment_id", nullable = false)
    private Long paymentId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "external_refund_id", unique = true, length = 128)
    private String externalRefundId;

    @Column(name = "amount", nullable = false)
    private Long amountMinor;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "source", nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private RefundSource source;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Refund record(Payment payment, Money amount, String externalRefundId, String reason, RefundSource source) {
        return Refund.builder()
                .paymentId(payment.getPaymentId())
                .orderId(payment.getOrderId())
                .externalRefundId(externalRefundId)
                .amountMinor(amount.getAmount())
                .currency(amount.getCurrency())
                .reason(reason)
                .source(source)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public Money getAmount() {
        return Money.ofMinor(amountMinor, currency);
    }
}
