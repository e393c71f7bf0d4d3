package com.hhplus.checkout.application.payment.listener;

import com.hhplus.checkout.common.exception.SideEffectException;
import com.hhplus.checkout.domain.catalog.Enrollment;
import com.hhplus.checkout.domain.catalog.EnrollmentRepository;
import com.hhplus.checkout.domain.order.event.OrderConfirmedEvent;
import com.hhplus.checkout.infrastructure.external.EmailNotificationClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 결제 확정 후속 처리 (수강 권한 부여, 주문 확인 메일)
 *
 * 이벤트 처리 시점: AFTER_COMMIT
 * - 주문 CONFIRMED / 결제 PAID가 커밋된 뒤에만 실행
 * - 롤백된 이벤트 처리에서는 실행되지 않음
 *
 * 실패 처리:
 * - 두 작업은 서로 독립적이며, 실패해도 로그만 남기고 전파하지 않음
 * - 금융 상태는 되돌리지 않음
 * - 수강 권한은 (course, user) 유니크 제약으로 재실행되어도 한 번만 부여
 */
@Slf4j
@Component
public class PaymentSideEffectDispatcher {

    private final EnrollmentRepository enrollmentRepository;
    private final EmailNotificationClient emailNotificationClient;

    public PaymentSideEffectDispatcher(EnrollmentRepository enrollmentRepository,
                                       EmailNotificationClient emailNotificationClient) {
        this.enrollmentRepository = enrollmentRepository;
        this.emailNotificationClient = emailNotificationClient;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderConfirmed(OrderConfirmedEvent event) {
        log.info("[PaymentSideEffectDispatcher] OrderConfirmedEvent 수신 - orderId={}, courses={}",
                event.getOrderId(), event.getCourseIds().size());

        grantEnrollments(event);
        sendConfirmationEmail(event);
    }

    void grantEnrollments(OrderConfirmedEvent event) {
        if (event.getCourseIds().isEmpty()) {
            return;
        }
        if (event.getUserId() == null) {
            log.warn("[PaymentSideEffectDispatcher] 사용자 없는 주문의 강의 항목 - orderId={}", event.getOrderId());
            return;
        }
        for (Long courseId : event.getCourseIds()) {
            try {
                boolean granted = enrollmentRepository.saveIfAbsent(
                        Enrollment.purchased(courseId, event.getUserId(), event.getOrderId()));
                log.info("[PaymentSideEffectDispatcher] 수강 권한 - orderId={}, courseId={}, userId={}, newlyGranted={}",
                        event.getOrderId(), courseId, event.getUserId(), granted);
            } catch (RuntimeException e) {
                SideEffectException failure = new SideEffectException("enrollment:" + courseId, event.getOrderId(), e);
                log.error("[PaymentSideEffectDispatcher] {}", failure.getMessage(), failure);
            }
        }
    }

    void sendConfirmationEmail(OrderConfirmedEvent event) {
        if (event.getEmail() == null || event.getEmail().isBlank()) {
            log.debug("[PaymentSideEffectDispatcher] 이메일 없음 - skip: orderId={}", event.getOrderId());
            return;
        }
        try {
            emailNotificationClient.sendOrderConfirmation(event.getEmail(), event.getOrderNumber(), event.getTotal());
        } catch (RuntimeException e) {
            SideEffectException failure = new SideEffectException("confirmation-email", event.getOrderId(), e);
            log.error("[PaymentSideEffectDispatcher] {}", failure.getMessage(), failure);
        }
    }
}
