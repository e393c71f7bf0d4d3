package com.hhplus.checkout.application.payment;

import com.hhplus.checkout.application.webhook.event.ChargeRefundedEvent;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.event.EventOutcome;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.payment.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * RefundTransactionService - 환불 반영 트랜잭션
 *
 * 관리자 환불과 프로세서 환불 이벤트가 같은 계산을 공유합니다.
 *   누적 환불액 = 기존 누적 + 이번 환불
 *   누적 ≥ 결제 금액 → Payment REFUNDED, Order REFUNDED
 *   그 외 → Payment PARTIALLY_REFUNDED, Order 상태 유지 (paymentStatus만 변경)
 *
 * 결제 행은 SELECT ... FOR UPDATE로 잠그고, 같은 프로세서 환불 ID는 한 번만 기록합니다.
 * 관리자 경로와 이벤트 경로 중 먼저 커밋한 쪽만 반영되고 늦은 쪽은 변화가 없습니다.
 */
@Slf4j
@Service
public class RefundTransactionService {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final RefundRepository refundRepository;

    public RefundTransactionService(PaymentRepository paymentRepository,
                                    OrderRepository orderRepository,
                                    RefundRepository refundRepository) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.refundRepository = refundRepository;
    }

    @Transactional
    public RefundResult applyAdminRefund(Long paymentId, Money amount, String externalRefundId, String reason) {
        Payment payment = paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PAYMENT_NOT_FOUND, paymentId));
        Order order = orderRepository.findByIdForUpdate(payment.getOrderId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.ORDER_NOT_FOUND, payment.getOrderId()));

        if (externalRefundId != null && refundRepository.existsByExternalRefundId(externalRefundId)) {
            log.info("[RefundTransactionService] 환불 이벤트가 먼저 반영됨 - paymentId={}, refundId={}",
                    paymentId, externalRefundId);
            return RefundResult.of(order, payment, externalRefundId, amount);
        }

        payment.validateRefund(amount);
        apply(payment, order, payment.getRefundedAmount().add(amount), amount, externalRefundId, reason,
                RefundSource.ADMIN);
        return RefundResult.of(order, payment, externalRefundId, amount);
    }

    /**
     * charge.refunded 이벤트 반영. amount_refunded는 누적 환불액입니다.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EventOutcome applyProcessorRefund(ChargeRefundedEvent event) {
        Optional<Payment> located = locate(event).flatMap(paymentRepository::findByIdForUpdate);
        if (located.isEmpty()) {
            log.warn("[RefundTransactionService] 환불 이벤트의 결제를 찾을 수 없음 - eventId={}, chargeId={}",
                    event.getEventId(), event.getChargeId());
            return EventOutcome.IGNORED;
        }
        Payment payment = located.get();
        if (!payment.isRefundable()) {
            log.warn("[RefundTransactionService] 환불 불가 상태의 결제 - paymentId={}, status={}",
                    payment.getPaymentId(), payment.getStatus());
            return EventOutcome.IGNORED;
        }

        Money newTotal = Money.ofMinor(event.getAmountRefundedMinor(), payment.getCurrency());
        if (newTotal.isLessThanOrEqual(payment.getRefundedAmount())) {
            log.info("[RefundTransactionService] 이미 반영된 환불 - paymentId={}, refunded={}, event={}",
                    payment.getPaymentId(), payment.getRefundedAmount(), newTotal);
            return EventOutcome.IGNORED;
        }
        if (newTotal.isGreaterThan(payment.getAmount())) {
            log.warn("[RefundTransactionService] 결제 금액을 넘는 누적 환불 - paymentId={}, amount={}, event={}",
                    payment.getPaymentId(), payment.getAmount(), newTotal);
            return EventOutcome.IGNORED;
        }

        Order order = orderRepository.findByIdForUpdate(payment.getOrderId()).orElse(null);
        if (order == null) {
            log.warn("[RefundTransactionService] 결제에 연결된 주문이 없음 - paymentId={}", payment.getPaymentId());
            return EventOutcome.IGNORED;
        }

        String refundId = event.getLatestRefundId();
        if (refundId != null && refundRepository.existsByExternalRefundId(refundId)) {
            refundId = null;
        }
        Money delta = newTotal.subtract(payment.getRefundedAmount());
        apply(payment, order, newTotal, delta, refundId, null, RefundSource.PROCESSOR);
        return EventOutcome.APPLIED;
    }

    private void apply(Payment payment, Order order, Money newTotal, Money delta,
                       String externalRefundId, String reason, RefundSource source) {
        boolean fullRefund = payment.applyRefundedTotal(newTotal);
        order.applyRefund(fullRefund);
        paymentRepository.save(payment);
        orderRepository.save(order);
        refundRepository.save(Refund.record(payment, delta, externalRefundId, reason, source));

        log.info("[RefundTransactionService] 환불 반영 - orderId={}, paymentId={}, amount={}, totalRefunded={}, full={}, source={}",
                order.getOrderId(), payment.getPaymentId(), delta, newTotal, fullRefund, source);
    }

    /**
     * 결제 ID만 찾고, 행은 호출자가 잠금과 함께 읽습니다.
     */
    private Optional<Long> locate(ChargeRefundedEvent event) {
        if (event.getChargeIntentId() != null) {
            Optional<Long> byIntent = paymentRepository.findIdByChargeIntentId(event.getChargeIntentId());
            if (byIntent.isPresent()) {
                return byIntent;
            }
        }
        return paymentRepository.findIdByChargeId(event.getChargeId());
    }
}
