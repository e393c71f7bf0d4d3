package com.hhplus.checkout.presentation.checkout;

import com.hhplus.checkout.application.checkout.CheckoutCommand;
import com.hhplus.checkout.application.checkout.CheckoutResult;
import com.hhplus.checkout.application.checkout.CheckoutService;
import com.hhplus.checkout.common.BaseControllerTest;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ExternalProcessorException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.cart.CartOwner;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.OrderStatus;
import com.hhplus.checkout.presentation.common.CartOwnerResolver;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * CheckoutControllerTest
 *
 * 테스트 대상: POST /checkout
 * - 로그인 사용자 / 세션 쿠키 게스트
 * - 소유자를 알 수 없는 요청
 * - 프로세서 오류 메시지 전달
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CheckoutController 단위 테스트")
class CheckoutControllerTest extends BaseControllerTest {

    @Mock
    private CheckoutService checkoutService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        mockMvc = buildMockMvc(new CheckoutController(checkoutService, new CartOwnerResolver()));
    }

    private CheckoutResult result() {
        return CheckoutResult.builder()
                .orderId(7L)
                .orderNumber("ORD-2610-ABC123")
                .status(OrderStatus.PENDING)
                .subtotal(Money.ofMinor(5000L, "USD"))
                .total(Money.ofMinor(5500L, "USD"))
                .chargeIntentId("ci_123")
                .clientSecret("ci_123_secret")
                .build();
    }

    @Test
    @DisplayName("체크아웃 - 로그인 사용자는 PENDING 주문과 client_secret을 받는다")
    void testCheckout_User() throws Exception {
        // Given
        when(checkoutService.checkout(any(CheckoutCommand.class))).thenReturn(result());

        // When & Then
        mockMvc.perform(post("/checkout").header(CartOwnerResolver.USER_HEADER, 1001L))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order_id").value(7))
                .andExpect(jsonPath("$.order_number").value("ORD-2610-ABC123"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.subtotal").value("50.00"))
                .andExpect(jsonPath("$.total").value("55.00"))
                .andExpect(jsonPath("$.currency").value("USD"))
                .andExpect(jsonPath("$.charge_intent_id").value("ci_123"))
                .andExpect(jsonPath("$.client_secret").value("ci_123_secret"));

        ArgumentCaptor<CheckoutCommand> captor = ArgumentCaptor.forClass(CheckoutCommand.class);
        verify(checkoutService).checkout(captor.capture());
        assertEquals(CartOwner.ofUser(1001L), captor.getValue().getOwner());
        assertNull(captor.getValue().getEmail());
    }

    @Test
    @DisplayName("체크아웃 - 게스트는 세션 쿠키와 이메일로 주문한다")
    void testCheckout_Guest() throws Exception {
        // Given
        when(checkoutService.checkout(any(CheckoutCommand.class))).thenReturn(result());

        // When & Then
        mockMvc.perform(post("/checkout")
                        .cookie(new Cookie(CartOwnerResolver.SESSION_COOKIE, "sess-abc"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"guest@example.com\"}"))
                .andExpect(status().isCreated());

        ArgumentCaptor<CheckoutCommand> captor = ArgumentCaptor.forClass(CheckoutCommand.class);
        verify(checkoutService).checkout(captor.capture());
        assertEquals(CartOwner.ofSession("sess-abc"), captor.getValue().getOwner());
        assertEquals("guest@example.com", captor.getValue().getEmail());
    }

    @Test
    @DisplayName("체크아웃 - 소유자를 알 수 없으면 CART_EMPTY")
    void testCheckout_UnknownOwner() throws Exception {
        // When & Then
        mockMvc.perform(post("/checkout"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_EMPTY"));
        verifyNoInteractions(checkoutService);
    }

    @Test
    @DisplayName("체크아웃 - 구매할 수 없는 항목이 있으면 400")
    void testCheckout_Unavailable() throws Exception {
        // Given
        when(checkoutService.checkout(any(CheckoutCommand.class)))
                .thenThrow(new ValidationException(ErrorCode.INSUFFICIENT_STOCK, "productId=100"));

        // When & Then
        mockMvc.perform(post("/checkout").header(CartOwnerResolver.USER_HEADER, 1001L))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_INSUFFICIENT_STOCK"));
    }

    @Test
    @DisplayName("체크아웃 - 프로세서 거절 메시지를 그대로 노출한다")
    void testCheckout_ProcessorRejected() throws Exception {
        // Given
        when(checkoutService.checkout(any(CheckoutCommand.class)))
                .thenThrow(new ExternalProcessorException("Amount must be at least 50 cents"));

        // When & Then
        mockMvc.perform(post("/checkout").header(CartOwnerResolver.USER_HEADER, 1001L))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value(ErrorCode.PROCESSOR_REQUEST_FAILED.getCode()))
                .andExpect(jsonPath("$.error_message").value("Amount must be at least 50 cents"));
    }
}
