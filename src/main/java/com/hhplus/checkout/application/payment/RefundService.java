package com.hhplus.checkout.application.payment;

import com.hhplus.checkout.application.processor.PaymentProcessorClient;
import com.hhplus.checkout.application.processor.ProcessorRefund;
import com.hhplus.checkout.application.processor.ProcessorRefundRequest;
import com.hhplus.checkout.common.exception.ConflictException;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * RefundService - 관리자 환불 (Application 계층)
 *
 * 플로우:
 *   1단계: 검증 (트랜잭션 없음) - 결제 존재, 환불 가능 상태, 금액 ≤ 잔액
 *   2단계: 프로세서 환불 생성 (트랜잭션/락 없음)
 *   3단계: 환불 반영 (RefundTransactionService, 결제 행 잠금 후 재검증)
 *
 * 프로세서 호출이 실패하면 로컬 상태는 바뀌지 않습니다.
 */
@Slf4j
@Service
public class RefundService {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final PaymentProcessorClient processorClient;
    private final RefundTransactionService refundTransactionService;

    public RefundService(PaymentRepository paymentRepository,
                         OrderRepository orderRepository,
                         PaymentProcessorClient processorClient,
                         RefundTransactionService refundTransactionService) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.processorClient = processorClient;
        this.refundTransactionService = refundTransactionService;
    }

    public RefundResult refund(RefundCommand command) {
        Long orderId = command.getOrderId();
        if (orderRepository.findById(orderId).isEmpty()) {
            throw new NotFoundException(ErrorCode.ORDER_NOT_FOUND, orderId);
        }
        Payment payment = paymentRepository.findByOrderId(orderId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PAYMENT_NOT_FOUND, "orderId=" + orderId));
        if (!payment.isRefundable() || payment.getChargeIntentId() == null) {
            throw new ConflictException(ErrorCode.PAYMENT_NOT_REFUNDABLE,
                    "paymentId=" + payment.getPaymentId() + ", status=" + payment.getStatus());
        }

        Money amount = resolveAmount(command, payment);
        payment.validateRefund(amount);

        ProcessorRefund processorRefund = processorClient.createRefund(ProcessorRefundRequest.builder()
                .chargeIntentId(payment.getChargeIntentId())
                .amount(amount)
                .reason(command.getReason())
                .idempotencyKey(idempotencyKey(payment, amount))
                .build());
        log.info("[RefundService] 프로세서 환불 생성 - orderId={}, refundId={}, amount={}",
                orderId, processorRefund.getId(), amount);

        return refundTransactionService.applyAdminRefund(payment.getPaymentId(), amount,
                processorRefund.getId(), command.getReason());
    }

    private Money resolveAmount(RefundCommand command, Payment payment) {
        if (command.getAmount() == null) {
            return payment.getRemainingRefundable();
        }
        try {
            return Money.of(command.getAmount(), payment.getCurrency());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_REFUND_AMOUNT, e.getMessage());
        }
    }

    /**
     * 같은 잔액 상태에서 같은 금액을 다시 요청하면 같은 키가 되어 프로세서에서 중복 환불되지 않습니다.
     */
    private String idempotencyKey(Payment payment, Money amount) {
        return "refund-" + payment.getPaymentId() + "-" + payment.getRefundedAmountMinor() + "-" + amount.getAmount();
    }
}
