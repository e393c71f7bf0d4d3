package com.hhplus.checkout.application.payment;

import com.hhplus.checkout.application.cart.CartService;
import com.hhplus.checkout.application.webhook.event.PaymentIntentEvent;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.event.EventOutcome;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderItem;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.order.event.OrderConfirmedEvent;
import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentRepository;
import com.hhplus.checkout.domain.payment.PaymentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * PaymentEventHandlerTest - Application 계층 단위 테스트
 *
 * 테스트 대상:
 * - 결제 성공: 결제 PAID, 주문 CONFIRMED, 장바구니 비움, OrderConfirmedEvent 발행
 * - 결제 실패: 결제 FAILED, 주문 PENDING 유지
 * - 찾을 수 없는 결제 / 이미 처리된 결제는 IGNORED
 * - PENDING이 아닌 주문의 결제 성공은 결제만 기록
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentEventHandler 단위 테스트")
class PaymentEventHandlerTest {

    private static final Long ORDER_ID = 1L;
    private static final Long CART_ID = 3L;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private CartService cartService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PaymentEventHandler handler;

    @BeforeEach
    void setUp() {
        handler = new PaymentEventHandler(paymentRepository, orderRepository, cartService, eventPublisher);
    }

    private Order pendingOrder() {
        List<OrderItem> items = new ArrayList<>();
        items.add(OrderItem.ofProduct(1L, null, "티셔츠", Money.parse("25.00", "USD"), 2));
        items.add(OrderItem.ofCourse(100L, "Spring 입문", Money.parse("10.00", "USD")));
        return Order.builder()
                .orderId(ORDER_ID)
                .orderNumber("ORD-2510-ABCDEF")
                .userId(10L)
                .cartId(CART_ID)
                .email("buyer@example.com")
                .status(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .currency("USD")
                .subtotalAmount(6000L)
                .taxAmount(0L)
                .shippingAmount(0L)
                .discountAmount(0L)
                .totalAmount(6000L)
                .orderItems(items)
                .build();
    }

    private Payment pendingPayment(String chargeIntentId) {
        return Payment.builder()
                .paymentId(7L)
                .orderId(ORDER_ID)
                .chargeIntentId(chargeIntentId)
                .amountMinor(6000L)
                .refundedAmountMinor(0L)
                .currency("USD")
                .status(PaymentStatus.PENDING)
                .build();
    }

    private PaymentIntentEvent succeeded(Long metadataOrderId) {
        return PaymentIntentEvent.builder()
                .eventId("evt_1")
                .rawType("payment_intent.succeeded")
                .createdAt(Instant.now())
                .succeeded(true)
                .chargeIntentId("ci_1")
                .amountMinor(6000L)
                .currency("usd")
                .chargeId("ch_1")
                .orderId(metadataOrderId)
                .build();
    }

    // ========== 결제 성공 ==========

    @Test
    @DisplayName("결제 성공 - 주문 확정, 장바구니 비움, 확정 이벤트 발행")
    void testHandleSucceeded_Confirms() {
        // Given
        Order order = pendingOrder();
        Payment payment = pendingPayment("ci_1");
        when(paymentRepository.findByChargeIntentId("ci_1")).thenReturn(Optional.of(payment));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));

        // When
        EventOutcome outcome = handler.handleSucceeded(succeeded(null));

        // Then
        assertEquals(EventOutcome.APPLIED, outcome);
        assertEquals(PaymentStatus.PAID, payment.getStatus());
        assertEquals("ch_1", payment.getChargeId());
        assertEquals(OrderStatus.CONFIRMED, order.getStatus());
        assertEquals(PaymentStatus.PAID, order.getPaymentStatus());
        verify(cartService).clearById(CART_ID);

        ArgumentCaptor<OrderConfirmedEvent> captor = ArgumentCaptor.forClass(OrderConfirmedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        OrderConfirmedEvent event = captor.getValue();
        assertEquals(ORDER_ID, event.getOrderId());
        assertEquals(List.of(100L), event.getCourseIds());
        assertEquals("buyer@example.com", event.getEmail());
        assertEquals(Money.parse("60.00", "USD"), event.getTotal());
    }

    @Test
    @DisplayName("결제 성공 - 결제 의도 연결 전에 도착하면 메타데이터 주문 ID로 찾는다")
    void testHandleSucceeded_FallbackToMetadataOrderId() {
        // Given
        Order order = pendingOrder();
        Payment payment = pendingPayment(null);
        when(paymentRepository.findByChargeIntentId("ci_1")).thenReturn(Optional.empty());
        when(paymentRepository.findByOrderId(ORDER_ID)).thenReturn(Optional.of(payment));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));

        // When
        EventOutcome outcome = handler.handleSucceeded(succeeded(ORDER_ID));

        // Then
        assertEquals(EventOutcome.APPLIED, outcome);
        assertEquals("ci_1", payment.getChargeIntentId());
        assertEquals(OrderStatus.CONFIRMED, order.getStatus());
    }

    @Test
    @DisplayName("결제 성공 - 이미 PAID인 결제는 IGNORED")
    void testHandleSucceeded_AlreadyPaid() {
        // Given
        Payment payment = pendingPayment("ci_1");
        payment.markPaid("ch_1");
        when(paymentRepository.findByChargeIntentId("ci_1")).thenReturn(Optional.of(payment));

        // When
        EventOutcome outcome = handler.handleSucceeded(succeeded(null));

        // Then
        assertEquals(EventOutcome.IGNORED, outcome);
        verify(orderRepository, never()).findByIdForUpdate(anyLong());
        verifyNoInteractions(cartService, eventPublisher);
    }

    @Test
    @DisplayName("결제 성공 - 찾을 수 없는 결제는 IGNORED")
    void testHandleSucceeded_UnknownPayment() {
        // Given
        when(paymentRepository.findByChargeIntentId("ci_1")).thenReturn(Optional.empty());

        // When
        EventOutcome outcome = handler.handleSucceeded(succeeded(null));

        // Then
        assertEquals(EventOutcome.IGNORED, outcome);
        verify(paymentRepository, never()).save(any());
    }

    @Test
    @DisplayName("결제 성공 - 취소된 주문이면 결제만 PAID로 기록하고 주문은 그대로 둔다")
    void testHandleSucceeded_CancelledOrder() {
        // Given
        Order order = pendingOrder();
        order.cancel();
        Payment payment = pendingPayment("ci_1");
        when(paymentRepository.findByChargeIntentId("ci_1")).thenReturn(Optional.of(payment));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));

        // When
        EventOutcome outcome = handler.handleSucceeded(succeeded(null));

        // Then
        assertEquals(EventOutcome.APPLIED, outcome);
        assertEquals(PaymentStatus.PAID, payment.getStatus());
        assertEquals(OrderStatus.CANCELLED, order.getStatus());
        verifyNoInteractions(cartService, eventPublisher);
    }

    // ========== 결제 실패 ==========

    @Test
    @DisplayName("결제 실패 - 결제 FAILED, 주문은 PENDING 유지")
    void testHandleFailed() {
        // Given
        Order order = pendingOrder();
        Payment payment = pendingPayment("ci_1");
        when(paymentRepository.findByChargeIntentId("ci_1")).thenReturn(Optional.of(payment));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));
        PaymentIntentEvent event = PaymentIntentEvent.builder()
                .eventId("evt_2")
                .rawType("payment_intent.payment_failed")
                .createdAt(Instant.now())
                .succeeded(false)
                .chargeIntentId("ci_1")
                .amountMinor(6000L)
                .failureMessage("Your card was declined.")
                .build();

        // When
        EventOutcome outcome = handler.handleFailed(event);

        // Then
        assertEquals(EventOutcome.APPLIED, outcome);
        assertEquals(PaymentStatus.FAILED, payment.getStatus());
        assertEquals("Your card was declined.", payment.getFailureMessage());
        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertEquals(PaymentStatus.FAILED, order.getPaymentStatus());
        verifyNoInteractions(cartService, eventPublisher);
    }
}
