package com.hhplus.checkout.domain.payment;

import com.hhplus.checkout.common.exception.ConflictException;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Payment 도메인 엔티티
 *
 * 주문의 결제 시도 1건과 1:1로 대응하며, 프로세서의 charge intent ID로 이벤트와 매칭됩니다.
 *
 * 핵심 비즈니스 규칙:
 * - refundedAmount ≤ amount
 * - PAID 또는 PARTIALLY_REFUNDED 상태에서만 환불 가능
 * - @Version 낙관적 락으로 동시 상태 변경 감지
 */
@Entity
@Table(name = "payments")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "payment_id")
    private Long paymentId;

    @Column(name = "order_id", nullable = false, unique = true)
    private Long orderId;

    @Column(name = "charge_intent_id", unique = true, length = 128)
    private String chargeIntentId;

    @Column(name = "charge_id", length = 128)
    private String chargeId;

    @Column(name = "amount", nullable = false)
    private Long amountMinor;

    @Column(name = "refunded_amount", nullable = false)
    private Long refundedAmountMinor;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "status", nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private PaymentStatus status;

    @Column(name = "failure_message", length = 500)
    private String failureMessage;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Payment pending(Long orderId, Money amount) {
        LocalDateTime now = LocalDateTime.now();
        return Payment.builder()
                .orderId(orderId)
                .amountMinor(amount.getAmount())
                .refundedAmountMinor(0L)
                .currency(amount.getCurrency())
                .status(PaymentStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Money getAmount() {
        return Money.ofMinor(amountMinor, currency);
    }

    public Money getRefundedAmount() {
        return Money.ofMinor(refundedAmountMinor, currency);
    }

    public Money getRemainingRefundable() {
        return getAmount().subtract(getRefundedAmount());
    }

    public void attachChargeIntent(String chargeIntentId) {
        if (this.status != PaymentStatus.PENDING) {
            throw new ConflictException(ErrorCode.INVALID_PAYMENT_STATUS,
                    "paymentId=" + paymentId + ", status=" + status);
        }
        this.chargeIntentId = chargeIntentId;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 상태 전환: PENDING/FAILED → PAID
     *
     * 실패 후 같은 결제 의도로 재시도해 성공할 수 있으므로 FAILED에서도 허용합니다.
     */
    public void markPaid(String chargeId) {
        if (!canBePaid()) {
            throw new ConflictException(ErrorCode.INVALID_PAYMENT_STATUS,
                    "결제 완료로 변경할 수 없습니다. paymentId=" + paymentId + ", status=" + status);
        }
        LocalDateTime now = LocalDateTime.now();
        this.status = PaymentStatus.PAID;
        this.chargeId = chargeId;
        this.failureMessage = null;
        this.paidAt = now;
        this.updatedAt = now;
    }

    public boolean canBePaid() {
        return this.status == PaymentStatus.PENDING || this.status == PaymentStatus.FAILED;
    }

    /**
     * 상태 전환: PENDING → FAILED
     */
    public void markFailed(String failureMessage) {
        if (this.status != PaymentStatus.PENDING) {
            throw new ConflictException(ErrorCode.INVALID_PAYMENT_STATUS,
                    "결제 실패로 변경할 수 없습니다. paymentId=" + paymentId + ", status=" + status);
        }
        this.status = PaymentStatus.FAILED;
        this.failureMessage = failureMessage;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isRefundable() {
        return status.isRefundable();
    }

    /**
     * 이번 환불 금액이 유효한지 검증합니다. 상태는 바꾸지 않습니다.
     *
     * @throws ConflictException   환불 불가 상태이거나 잔액 초과
     * @throws ValidationException 0 이하 금액
     */
    public void validateRefund(Money refundAmount) {
        if (!isRefundable()) {
            throw new ConflictException(ErrorCode.PAYMENT_NOT_REFUNDABLE,
                    "paymentId=" + paymentId + ", status=" + status);
        }
        if (!refundAmount.isPositive()) {
            throw new ValidationException(ErrorCode.INVALID_REFUND_AMOUNT, "환불 금액은 0보다 커야 합니다");
        }
        if (refundAmount.isGreaterThan(getRemainingRefundable())) {
            throw new ConflictException(ErrorCode.REFUND_EXCEEDS_REMAINING,
                    String.format("요청=%s, 잔액=%s", refundAmount.toDecimalString(),
                            getRemainingRefundable().toDecimalString()));
        }
    }

    /**
     * 누적 환불액을 반영합니다.
     *
     * @param newRefundedTotal 이번 환불을 포함한 누적 환불액
     * @return 전액 환불이면 true
     */
    public boolean applyRefundedTotal(Money newRefundedTotal) {
        if (!isRefundable()) {
            throw new ConflictException(ErrorCode.PAYMENT_NOT_REFUNDABLE,
                    "paymentId=" + paymentId + ", status=" + status);
        }
        if (newRefundedTotal.isGreaterThan(getAmount())) {
            throw new ConflictException(ErrorCode.REFUND_EXCEEDS_REMAINING,
                    String.format("누적 환불=%s, 결제 금액=%s", newRefundedTotal.toDecimalString(),
                            getAmount().toDecimalString()));
        }
        boolean fullRefund = newRefundedTotal.isGreaterThanOrEqual(getAmount());
        this.refundedAmountMinor = newRefundedTotal.getAmount();
        this.status = fullRefund ? PaymentStatus.REFUNDED : PaymentStatus.PARTIALLY_REFUNDED;
        this.updatedAt = LocalDateTime.now();
        return fullRefund;
    }
}
