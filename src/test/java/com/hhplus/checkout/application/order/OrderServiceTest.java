package com.hhplus.checkout.application.order;

import com.hhplus.checkout.application.order.dto.OrderView;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.InvalidOrderStatusException;
import com.hhplus.checkout.domain.order.Order;
import com.hhplus.checkout.domain.order.OrderAdjustments;
import com.hhplus.checkout.domain.order.OrderItem;
import com.hhplus.checkout.domain.order.OrderRepository;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.payment.Payment;
import com.hhplus.checkout.domain.payment.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * OrderServiceTest
 *
 * 테스트 대상:
 * - 본인 주문만 조회 (로그인 사용자 / 주문 세션)
 * - 관리자 취소, 배송 시작, 배송 완료 상태 전환
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("OrderService 단위 테스트")
class OrderServiceTest {

    private static final String CURRENCY = "USD";

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private PaymentRepository paymentRepository;

    private OrderService orderService;

    @BeforeEach
    void setUp() {
        orderService = new OrderService(orderRepository, paymentRepository);
        when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(paymentRepository.findByOrderId(any())).thenReturn(Optional.empty());
    }

    private Order userOrder() {
        OrderItem item = OrderItem.ofProduct(1L, null, "티셔츠", Money.parse("25.00", CURRENCY), 2);
        return Order.place("ORD-2610-AAAAAA", 1001L, null, 1L, "buyer@example.com",
                List.of(item), OrderAdjustments.none(CURRENCY));
    }

    private Order guestOrder() {
        OrderItem item = OrderItem.ofProduct(1L, null, "티셔츠", Money.parse("25.00", CURRENCY), 1);
        return Order.place("ORD-2610-BBBBBB", null, "sess-abc", 2L, "guest@example.com",
                List.of(item), OrderAdjustments.none(CURRENCY));
    }

    @Test
    @DisplayName("조회 - 주문한 사용자는 상세와 환불 누계를 받는다")
    void testGetOrder_Owner() {
        // Given
        Order order = userOrder();
        when(orderRepository.findById(7L)).thenReturn(Optional.of(order));
        when(paymentRepository.findByOrderId(any())).thenReturn(Optional.of(Payment.pending(7L, order.getTotal())));

        // When
        OrderView view = orderService.getOrder(7L, 1001L, null);

        // Then
        assertEquals("ORD-2610-AAAAAA", view.getOrderNumber());
        assertEquals(Money.parse("50.00", CURRENCY), view.getTotal());
        assertTrue(view.getRefundedAmount().isZero());
        assertEquals(1, view.getItems().size());
    }

    @Test
    @DisplayName("조회 - 다른 사용자의 주문은 404")
    void testGetOrder_OtherUser() {
        // Given
        when(orderRepository.findById(7L)).thenReturn(Optional.of(userOrder()));

        // When & Then
        assertThrows(NotFoundException.class, () -> orderService.getOrder(7L, 2002L, null));
        assertThrows(NotFoundException.class, () -> orderService.getOrder(7L, null, "sess-abc"));
    }

    @Test
    @DisplayName("조회 - 게스트 주문은 주문 세션으로만 조회된다")
    void testGetOrder_Guest() {
        // Given
        when(orderRepository.findById(8L)).thenReturn(Optional.of(guestOrder()));

        // When & Then
        assertEquals("ORD-2610-BBBBBB", orderService.getOrder(8L, null, "sess-abc").getOrderNumber());
        assertThrows(NotFoundException.class, () -> orderService.getOrder(8L, null, "sess-other"));
        assertThrows(NotFoundException.class, () -> orderService.getOrder(8L, 1001L, null));
    }

    @Test
    @DisplayName("배송 시작 → 배송 완료")
    void testShipThenDeliver() {
        // Given
        Order order = userOrder();
        order.confirmPayment();
        when(orderRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(order));

        // When
        OrderView shipped = orderService.ship(7L, "  1Z999AA10123456784 ");
        OrderView delivered = orderService.deliver(7L);

        // Then
        assertEquals(OrderStatus.SHIPPED, shipped.getStatus());
        assertEquals("1Z999AA10123456784", shipped.getTrackingNumber());
        assertEquals(OrderStatus.DELIVERED, delivered.getStatus());
        assertNotNull(delivered.getDeliveredAt());
    }

    @Test
    @DisplayName("배송 시작 - 운송장 번호가 없으면 조회 없이 거부")
    void testShip_MissingTracking() {
        // When & Then
        assertThrows(ValidationException.class, () -> orderService.ship(7L, " "));
        verify(orderRepository, never()).findByIdForUpdate(anyLong());
    }

    @Test
    @DisplayName("취소 - 확정 주문은 취소되고, 배송 중인 주문은 거부된다")
    void testCancel() {
        // Given
        Order confirmed = userOrder();
        confirmed.confirmPayment();
        Order shipped = userOrder();
        shipped.confirmPayment();
        shipped.ship("TRACK-1");
        when(orderRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(confirmed));
        when(orderRepository.findByIdForUpdate(9L)).thenReturn(Optional.of(shipped));

        // When
        OrderView cancelled = orderService.cancel(7L);

        // Then
        assertEquals(OrderStatus.CANCELLED, cancelled.getStatus());
        assertThrows(InvalidOrderStatusException.class, () -> orderService.cancel(9L));
        verify(orderRepository, times(1)).save(any(Order.class));
    }

    @Test
    @DisplayName("없는 주문은 404")
    void testNotFound() {
        // Given
        when(orderRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        // When & Then
        assertThrows(NotFoundException.class, () -> orderService.deliver(99L));
    }
}
