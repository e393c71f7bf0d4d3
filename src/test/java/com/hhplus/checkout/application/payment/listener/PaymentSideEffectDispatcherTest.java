package com.hhplus.checkout.application.payment.listener;

import com.hhplus.checkout.domain.catalog.Enrollment;
import com.hhplus.checkout.domain.catalog.EnrollmentRepository;
import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.event.OrderConfirmedEvent;
import com.hhplus.checkout.infrastructure.external.EmailNotificationClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * PaymentSideEffectDispatcherTest
 *
 * 테스트 대상:
 * - 강의마다 수강 권한 부여, 확인 메일 발송
 * - 한 작업의 실패가 다른 작업을 막지 않고 예외를 전파하지 않음
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentSideEffectDispatcher 단위 테스트")
class PaymentSideEffectDispatcherTest {

    @Mock
    private EnrollmentRepository enrollmentRepository;

    @Mock
    private EmailNotificationClient emailNotificationClient;

    @InjectMocks
    private PaymentSideEffectDispatcher dispatcher;

    private OrderConfirmedEvent event(Long userId, String email, List<Long> courseIds) {
        return new OrderConfirmedEvent(1L, "ORD-2510-ABCDEF", userId, email, courseIds, Money.parse("60.00", "USD"));
    }

    @Test
    @DisplayName("수강 권한 부여와 확인 메일 발송")
    void testHandleOrderConfirmed() {
        // Given
        when(enrollmentRepository.saveIfAbsent(any(Enrollment.class))).thenReturn(true);

        // When
        dispatcher.handleOrderConfirmed(event(10L, "buyer@example.com", List.of(100L, 101L)));

        // Then
        verify(enrollmentRepository, times(2)).saveIfAbsent(any(Enrollment.class));
        verify(emailNotificationClient).sendOrderConfirmation(eq("buyer@example.com"), eq("ORD-2510-ABCDEF"), any(Money.class));
    }

    @Test
    @DisplayName("수강 권한 부여 실패가 메일 발송을 막지 않는다")
    void testHandleOrderConfirmed_EnrollmentFailureIsolated() {
        // Given
        when(enrollmentRepository.saveIfAbsent(any(Enrollment.class)))
                .thenThrow(new IllegalStateException("DB down"))
                .thenReturn(true);

        // When & Then
        assertDoesNotThrow(() -> dispatcher.handleOrderConfirmed(event(10L, "buyer@example.com", List.of(100L, 101L))));
        verify(enrollmentRepository, times(2)).saveIfAbsent(any(Enrollment.class));
        verify(emailNotificationClient).sendOrderConfirmation(anyString(), anyString(), any(Money.class));
    }

    @Test
    @DisplayName("메일 발송 실패는 전파되지 않는다")
    void testHandleOrderConfirmed_EmailFailureSwallowedWithLog() {
        // Given
        doThrow(new IllegalStateException("SMTP down"))
                .when(emailNotificationClient).sendOrderConfirmation(anyString(), anyString(), any(Money.class));

        // When & Then
        assertDoesNotThrow(() -> dispatcher.handleOrderConfirmed(event(null, "guest@example.com", List.of())));
        verifyNoInteractions(enrollmentRepository);
    }

    @Test
    @DisplayName("이메일이 없으면 메일을 보내지 않는다")
    void testHandleOrderConfirmed_NoEmail() {
        // When
        dispatcher.handleOrderConfirmed(event(10L, null, List.of()));

        // Then
        verifyNoInteractions(emailNotificationClient, enrollmentRepository);
    }
}
