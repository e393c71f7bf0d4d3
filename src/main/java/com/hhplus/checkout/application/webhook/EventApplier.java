package com.hhplus.checkout.application.webhook;

import com.hhplus.checkout.application.payment.PaymentEventHandler;
import com.hhplus.checkout.application.payment.RefundTransactionService;
import com.hhplus.checkout.application.subscription.SubscriptionEventHandler;
import com.hhplus.checkout.application.webhook.event.*;
import com.hhplus.checkout.domain.event.EventOutcome;
import com.hhplus.checkout.domain.event.ProcessedEvent;
import com.hhplus.checkout.domain.event.ProcessedEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 이벤트 반영 트랜잭션
 *
 * 원장 INSERT와 상태 변경이 하나의 트랜잭션입니다.
 * 원장만 남고 상태가 빠지거나, 상태만 바뀌고 원장이 빠지는 경우가 없어야 합니다.
 *
 * 1. processed_events INSERT (즉시 flush, PK 충돌 시 DuplicateEventException → 롤백)
 * 2. 유형별 상태 머신으로 분기
 * 3. 결과(outcome)를 원장 행에 기록
 */
@Slf4j
@Service
public class EventApplier {

    private final ProcessedEventRepository processedEventRepository;
    private final PaymentEventHandler paymentEventHandler;
    private final RefundTransactionService refundTransactionService;
    private final SubscriptionEventHandler subscriptionEventHandler;

    public EventApplier(ProcessedEventRepository processedEventRepository,
                        PaymentEventHandler paymentEventHandler,
                        RefundTransactionService refundTransactionService,
                        SubscriptionEventHandler subscriptionEventHandler) {
        this.processedEventRepository = processedEventRepository;
        this.paymentEventHandler = paymentEventHandler;
        this.refundTransactionService = refundTransactionService;
        this.subscriptionEventHandler = subscriptionEventHandler;
    }

    @Transactional
    public EventOutcome apply(ProcessorEvent event) {
        ProcessedEvent entry;
        try {
            entry = processedEventRepository.insert(new ProcessedEvent(event.getEventId(), event.getRawType()));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateEventException(event.getEventId(), e);
        }

        EventOutcome outcome = dispatch(event);
        entry.complete(outcome);
        log.info("[EventApplier] 이벤트 반영 - eventId={}, type={}, outcome={}",
                event.getEventId(), event.getRawType(), outcome);
        return outcome;
    }

    private EventOutcome dispatch(ProcessorEvent event) {
        switch (event.getType()) {
            case PAYMENT_SUCCEEDED:
                return paymentEventHandler.handleSucceeded((PaymentIntentEvent) event);
            case PAYMENT_FAILED:
                return paymentEventHandler.handleFailed((PaymentIntentEvent) event);
            case CHARGE_REFUNDED:
                return refundTransactionService.applyProcessorRefund((ChargeRefundedEvent) event);
            case CHECKOUT_COMPLETED:
            case SUBSCRIPTION_CREATED:
            case SUBSCRIPTION_UPDATED:
            case SUBSCRIPTION_DELETED:
                return subscriptionEventHandler.handleLifecycle((SubscriptionLifecycleEvent) event);
            case INVOICE_PAYMENT_FAILED:
                return subscriptionEventHandler.handleInvoiceFailed((InvoicePaymentFailedEvent) event);
            default:
                log.info("[EventApplier] 처리 대상이 아닌 이벤트 - eventId={}, type={}", event.getEventId(), event.getRawType());
                return EventOutcome.IGNORED;
        }
    }
}
