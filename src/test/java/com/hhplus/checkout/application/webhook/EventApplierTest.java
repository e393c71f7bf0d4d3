package com.hhplus.checkout.application.webhook;

import com.hhplus.checkout.application.payment.PaymentEventHandler;
import com.hhplus.checkout.application.payment.RefundTransactionService;
import com.hhplus.checkout.application.subscription.SubscriptionEventHandler;
import com.hhplus.checkout.application.webhook.event.PaymentIntentEvent;
import com.hhplus.checkout.application.webhook.event.UnsupportedEvent;
import com.hhplus.checkout.domain.event.EventOutcome;
import com.hhplus.checkout.domain.event.ProcessedEvent;
import com.hhplus.checkout.domain.event.ProcessedEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventApplier 단위 테스트")
class EventApplierTest {

    @Mock
    private ProcessedEventRepository processedEventRepository;

    @Mock
    private PaymentEventHandler paymentEventHandler;

    @Mock
    private RefundTransactionService refundTransactionService;

    @Mock
    private SubscriptionEventHandler subscriptionEventHandler;

    private EventApplier eventApplier;

    @BeforeEach
    void setUp() {
        eventApplier = new EventApplier(processedEventRepository, paymentEventHandler,
                refundTransactionService, subscriptionEventHandler);
    }

    @Test
    @DisplayName("원장을 기록하고 유형별 처리기로 분기한 뒤 결과를 원장에 남긴다")
    void testApply_DispatchesAndRecordsOutcome() {
        // Given
        PaymentIntentEvent event = PaymentIntentEvent.builder()
                .eventId("evt_1")
                .rawType("payment_intent.succeeded")
                .createdAt(Instant.now())
                .succeeded(true)
                .chargeIntentId("ci_1")
                .build();
        when(processedEventRepository.insert(any(ProcessedEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(paymentEventHandler.handleSucceeded(event)).thenReturn(EventOutcome.APPLIED);

        // When
        EventOutcome outcome = eventApplier.apply(event);

        // Then
        assertEquals(EventOutcome.APPLIED, outcome);
        ArgumentCaptor<ProcessedEvent> captor = ArgumentCaptor.forClass(ProcessedEvent.class);
        verify(processedEventRepository).insert(captor.capture());
        assertEquals("evt_1", captor.getValue().getEventId());
        assertEquals(EventOutcome.APPLIED, captor.getValue().getOutcome());
    }

    @Test
    @DisplayName("지원하지 않는 유형은 원장에 IGNORED로 남긴다")
    void testApply_Unsupported() {
        // Given
        when(processedEventRepository.insert(any(ProcessedEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        EventOutcome outcome = eventApplier.apply(new UnsupportedEvent("evt_2", "customer.created", Instant.now()));

        // Then
        assertEquals(EventOutcome.IGNORED, outcome);
        verifyNoInteractions(paymentEventHandler, refundTransactionService, subscriptionEventHandler);
    }

    @Test
    @DisplayName("원장 PK 충돌은 DuplicateEventException으로 바꾸고 상태를 건드리지 않는다")
    void testApply_DuplicateInsert() {
        // Given
        when(processedEventRepository.insert(any(ProcessedEvent.class)))
                .thenThrow(new DataIntegrityViolationException("Duplicate entry 'evt_3' for key 'PRIMARY'"));

        // When & Then
        DuplicateEventException e = assertThrows(DuplicateEventException.class,
                () -> eventApplier.apply(new UnsupportedEvent("evt_3", "charge.refunded", Instant.now())));
        assertEquals("evt_3", e.getEventId());
        verifyNoInteractions(paymentEventHandler, refundTransactionService, subscriptionEventHandler);
    }
}
