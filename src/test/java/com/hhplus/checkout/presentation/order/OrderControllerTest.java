package com.hhplus.checkout.presentation.order;

import com.hhplus.checkout.application.order.OrderService;
import com.hhplus.checkout.application.order.dto.OrderView;
import com.hhplus.checkout.common.BaseControllerTest;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.domain.payment.PaymentStatus;
import com.hhplus.checkout.presentation.common.CartOwnerResolver;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderController 단위 테스트")
class OrderControllerTest extends BaseControllerTest {

    @Mock
    private OrderService orderService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        mockMvc = buildMockMvc(new OrderController(orderService, new CartOwnerResolver()));
    }

    static OrderView orderView(OrderStatus status, PaymentStatus paymentStatus) {
        OrderView.Item item = OrderView.Item.builder()
                .orderItemId(1L)
                .itemType("PRODUCT")
                .productId(100L)
                .variantId(5L)
                .name("티셔츠 - L")
                .quantity(2)
                .unitPrice(Money.ofMinor(2500L, "USD"))
                .lineTotal(Money.ofMinor(5000L, "USD"))
                .build();
        return OrderView.builder()
                .orderId(7L)
                .orderNumber("ORD-2610-ABC123")
                .status(status)
                .paymentStatus(paymentStatus)
                .email("buyer@example.com")
                .subtotal(Money.ofMinor(5000L, "USD"))
                .tax(Money.zero("USD"))
                .shipping(Money.zero("USD"))
                .discount(Money.zero("USD"))
                .total(Money.ofMinor(5000L, "USD"))
                .refundedAmount(Money.zero("USD"))
                .items(List.of(item))
                .createdAt(LocalDateTime.of(2026, 10, 1, 12, 0, 0))
                .build();
    }

    @Test
    @DisplayName("주문 상세 조회 - 로그인 사용자")
    void testGetOrderDetail_User() throws Exception {
        // Given
        when(orderService.getOrder(7L, 1001L, null)).thenReturn(orderView(OrderStatus.CONFIRMED, PaymentStatus.PAID));

        // When & Then
        mockMvc.perform(get("/orders/7").header(CartOwnerResolver.USER_HEADER, 1001L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_number").value("ORD-2610-ABC123"))
                .andExpect(jsonPath("$.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.payment_status").value("PAID"))
                .andExpect(jsonPath("$.total").value("50.00"))
                .andExpect(jsonPath("$.refunded_amount").value("0.00"))
                .andExpect(jsonPath("$.items[0].line_total").value("50.00"))
                .andExpect(jsonPath("$.created_at").value("2026-10-01T12:00:00"))
                .andExpect(jsonPath("$.tracking_number").doesNotExist());
    }

    @Test
    @DisplayName("주문 상세 조회 - 게스트는 주문 시 세션 쿠키로 조회한다")
    void testGetOrderDetail_Guest() throws Exception {
        // Given
        when(orderService.getOrder(7L, null, "sess-abc")).thenReturn(orderView(OrderStatus.PENDING, PaymentStatus.PENDING));

        // When & Then
        mockMvc.perform(get("/orders/7").cookie(new Cookie(CartOwnerResolver.SESSION_COOKIE, "sess-abc")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("주문 상세 조회 - 본인 주문이 아니면 404")
    void testGetOrderDetail_NotOwner() throws Exception {
        // Given
        when(orderService.getOrder(7L, 2002L, null)).thenThrow(new NotFoundException(ErrorCode.ORDER_NOT_FOUND, 7L));

        // When & Then
        mockMvc.perform(get("/orders/7").header(CartOwnerResolver.USER_HEADER, 2002L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ORDER_NOT_FOUND"));
    }

    @Test
    @DisplayName("주문 상세 조회 - 식별 정보가 없으면 404")
    void testGetOrderDetail_Anonymous() throws Exception {
        // Given
        when(orderService.getOrder(eq(7L), isNull(), isNull()))
                .thenThrow(new NotFoundException(ErrorCode.ORDER_NOT_FOUND, 7L));

        // When & Then
        mockMvc.perform(get("/orders/7"))
                .andExpect(status().isNotFound());
    }
}
