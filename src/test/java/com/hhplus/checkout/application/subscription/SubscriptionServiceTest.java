package com.hhplus.checkout.application.subscription;

import com.hhplus.checkout.application.processor.PaymentProcessorClient;
import com.hhplus.checkout.application.processor.SubscriptionCheckoutRequest;
import com.hhplus.checkout.application.processor.SubscriptionCheckoutSession;
import com.hhplus.checkout.application.subscription.dto.StartSubscriptionCommand;
import com.hhplus.checkout.application.subscription.dto.SubscriptionCheckoutResult;
import com.hhplus.checkout.application.subscription.dto.SubscriptionView;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.NotFoundException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.subscription.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubscriptionService 단위 테스트")
class SubscriptionServiceTest {

    @Mock
    private SubscriptionPlanRepository planRepository;

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private PaymentProcessorClient processorClient;

    private SubscriptionService subscriptionService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-10-15T09:30:00Z"), ZoneOffset.UTC);
        subscriptionService = new SubscriptionService(planRepository, subscriptionRepository, processorClient, clock,
                "https://shop.example.com/subscription/success", "https://shop.example.com/pricing");
    }

    @Test
    @DisplayName("구독 체크아웃 - 주기에 맞는 가격 ID로 세션을 만든다")
    void testStartCheckout() {
        // Given
        SubscriptionPlan pro = SubscriptionPlan.builder()
                .planId("pro").slug("pro").name("Pro")
                .monthlyPriceId("price_pro_m").yearlyPriceId("price_pro_y").active(true).build();
        when(planRepository.findById("pro")).thenReturn(Optional.of(pro));
        when(processorClient.createSubscriptionCheckout(any(SubscriptionCheckoutRequest.class)))
                .thenReturn(new SubscriptionCheckoutSession("cs_1", "https://pay.example.com/cs_1"));

        // When
        SubscriptionCheckoutResult result = subscriptionService.startCheckout(
                new StartSubscriptionCommand(10L, "buyer@example.com", "pro", BillingCycle.YEARLY));

        // Then
        assertEquals("cs_1", result.getSessionId());
        assertEquals("https://pay.example.com/cs_1", result.getUrl());
        ArgumentCaptor<SubscriptionCheckoutRequest> captor = ArgumentCaptor.forClass(SubscriptionCheckoutRequest.class);
        verify(processorClient).createSubscriptionCheckout(captor.capture());
        assertEquals("price_pro_y", captor.getValue().getPriceId());
        assertEquals("subscription-10-pro-YEARLY-202510150930", captor.getValue().getIdempotencyKey());
        verifyNoInteractions(subscriptionRepository);
    }

    @Test
    @DisplayName("구독 체크아웃 - 해당 주기 가격이 없는 플랜은 거부")
    void testStartCheckout_PriceNotConfigured() {
        // Given
        SubscriptionPlan monthlyOnly = SubscriptionPlan.builder()
                .planId("basic").slug("basic").name("Basic").monthlyPriceId("price_basic_m").active(true).build();
        when(planRepository.findById("basic")).thenReturn(Optional.of(monthlyOnly));

        // When & Then
        ValidationException e = assertThrows(ValidationException.class, () -> subscriptionService.startCheckout(
                new StartSubscriptionCommand(10L, null, "basic", BillingCycle.YEARLY)));
        assertEquals(ErrorCode.PLAN_PRICE_NOT_CONFIGURED, e.getErrorCode());
        verifyNoInteractions(processorClient);
    }

    @Test
    @DisplayName("구독 체크아웃 - 없거나 비활성인 플랜은 404")
    void testStartCheckout_PlanNotFound() {
        // Given
        SubscriptionPlan retired = SubscriptionPlan.builder()
                .planId("legacy").slug("legacy").name("Legacy").monthlyPriceId("price_legacy").active(false).build();
        when(planRepository.findById("legacy")).thenReturn(Optional.of(retired));
        when(planRepository.findById("nope")).thenReturn(Optional.empty());

        // When & Then
        assertThrows(NotFoundException.class, () -> subscriptionService.startCheckout(
                new StartSubscriptionCommand(10L, null, "legacy", BillingCycle.MONTHLY)));
        assertThrows(NotFoundException.class, () -> subscriptionService.startCheckout(
                new StartSubscriptionCommand(10L, null, "nope", BillingCycle.MONTHLY)));
    }

    @Test
    @DisplayName("내 구독 조회 - 없으면 404")
    void testGetMySubscription() {
        // Given
        Subscription subscription = Subscription.start(10L);
        subscription.sync("pro", SubscriptionStatus.ACTIVE, BillingCycle.MONTHLY, "sub_1", "cus_1", null, null, false);
        when(subscriptionRepository.findByUserId(10L)).thenReturn(Optional.of(subscription));
        when(subscriptionRepository.findByUserId(11L)).thenReturn(Optional.empty());

        // When
        SubscriptionView view = subscriptionService.getMySubscription(10L);

        // Then
        assertEquals("pro", view.getPlanId());
        assertEquals(SubscriptionStatus.ACTIVE, view.getStatus());
        NotFoundException e = assertThrows(NotFoundException.class, () -> subscriptionService.getMySubscription(11L));
        assertEquals(ErrorCode.SUBSCRIPTION_NOT_FOUND, e.getErrorCode());
    }
}
