package com.hhplus.checkout.application.payment;

import com.hhplus.checkout.application.cart.CartService;
import com.hhplus.checkout.application.webhook.event.PaymentIntentEvent;
import com.hhplus.checkout.domain.event.EventOutcome;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.order.event.OrderConfirmedEvent;
import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentRepository;
import com.hhplus.checkout.domain.payment.PaymentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 결제 이벤트 처리 (Order/Payment 상태 머신)
 *
 * EventApplier의 트랜잭션 안에서만 호출됩니다. 이벤트 원장 INSERT와 같은 커밋 단위입니다.
 *
 * 결제 성공:
 *   Payment PENDING|FAILED → PAID, Order PENDING → CONFIRMED, 원본 장바구니 비움,
 *   커밋 후 부수 효과(수강 권한, 확인 메일)를 위해 OrderConfirmedEvent 발행
 * 결제 실패:
 *   Payment PENDING → FAILED, Order는 PENDING 유지 (paymentStatus만 FAILED)
 */
@Slf4j
@Component
public class PaymentEventHandler {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final CartService cartService;
    private final ApplicationEventPublisher eventPublisher;

    public PaymentEventHandler(PaymentRepository paymentRepository,
                               OrderRepository orderRepository,
                               CartService cartService,
                               ApplicationEventPublisher eventPublisher) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.cartService = cartService;
        this.eventPublisher = eventPublisher;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EventOutcome handleSucceeded(PaymentIntentEvent event) {
        Optional<Payment> found = findPayment(event);
        if (found.isEmpty()) {
            log.warn("[PaymentEventHandler] 결제를 찾을 수 없음 - eventId={}, chargeIntentId={}",
                    event.getEventId(), event.getChargeIntentId());
            return EventOutcome.IGNORED;
        }
        Payment payment = found.get();
        if (!payment.canBePaid()) {
            log.info("[PaymentEventHandler] 이미 처리된 결제 - paymentId={}, status={}",
                    payment.getPaymentId(), payment.getStatus());
            return EventOutcome.IGNORED;
        }
        if (event.getAmountMinor() != payment.getAmountMinor()) {
            log.warn("[PaymentEventHandler] 결제 금액 불일치 - paymentId={}, expected={}, actual={}",
                    payment.getPaymentId(), payment.getAmountMinor(), event.getAmountMinor());
        }

        Optional<Order> foundOrder = orderRepository.findByIdForUpdate(payment.getOrderId());
        if (foundOrder.isEmpty()) {
            log.warn("[PaymentEventHandler] 결제에 연결된 주문이 없음 - paymentId={}, orderId={}",
                    payment.getPaymentId(), payment.getOrderId());
            return EventOutcome.IGNORED;
        }
        Order order = foundOrder.get();

        if (payment.getChargeIntentId() == null) {
            payment.attachChargeIntent(event.getChargeIntentId());
        }
        payment.markPaid(event.getChargeId());
        paymentRepository.save(payment);

        if (!order.isPending()) {
            // 결제는 실제로 잡혔으므로 기록은 남기고, 환불 가능한 상태로 둠
            log.error("[PaymentEventHandler] PENDING이 아닌 주문에 결제 성공 - 수동 환불 필요. orderId={}, status={}",
                    order.getOrderId(), order.getStatus());
            return EventOutcome.APPLIED;
        }

        order.confirmPayment();
        orderRepository.save(order);
        if (order.getCartId() != null) {
            cartService.clearById(order.getCartId());
        }

        eventPublisher.publishEvent(new OrderConfirmedEvent(order.getOrderId(), order.getOrderNumber(),
                order.getUserId(), order.getEmail(), order.getCourseIds(), order.getTotal()));

        log.info("[PaymentEventHandler] 결제 확정 - orderId={}, paymentId={}, total={}",
                order.getOrderId(), payment.getPaymentId(), order.getTotal());
        return EventOutcome.APPLIED;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EventOutcome handleFailed(PaymentIntentEvent event) {
        Optional<Payment> found = findPayment(event);
        if (found.isEmpty()) {
            log.warn("[PaymentEventHandler] 결제를 찾을 수 없음 - eventId={}, chargeIntentId={}",
                    event.getEventId(), event.getChargeIntentId());
            return EventOutcome.IGNORED;
        }
        Payment payment = found.get();
        if (payment.getStatus() != PaymentStatus.PENDING) {
            log.info("[PaymentEventHandler] PENDING이 아닌 결제의 실패 이벤트 - paymentId={}, status={}",
                    payment.getPaymentId(), payment.getStatus());
            return EventOutcome.IGNORED;
        }

        payment.markFailed(event.getFailureMessage());
        paymentRepository.save(payment);

        orderRepository.findByIdForUpdate(payment.getOrderId())
                .filter(Order::isPending)
                .ifPresent(order -> {
                    order.markPaymentFailed();
                    orderRepository.save(order);
                });

        log.info("[PaymentEventHandler] 결제 실패 기록 - paymentId={}, reason={}",
                payment.getPaymentId(), event.getFailureMessage());
        return EventOutcome.APPLIED;
    }

    /**
     * charge intent ID로 찾고, 없으면 메타데이터의 주문 ID로 찾습니다
     * (체크아웃 중 intent ID 연결 전에 이벤트가 먼저 도착한 경우).
     */
    private Optional<Payment> findPayment(PaymentIntentEvent event) {
        Optional<Payment> byIntent = paymentRepository.findByChargeIntentId(event.getChargeIntentId());
        if (byIntent.isPresent() || event.getOrderId() == null) {
            return byIntent;
        }
        return paymentRepository.findByOrderId(event.getOrderId())
                .filter(payment -> payment.getChargeIntentId() == null);
    }
}
