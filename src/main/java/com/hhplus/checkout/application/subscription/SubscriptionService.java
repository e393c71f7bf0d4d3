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
import com.hhplus.checkout.domain.subscription.SubscriptionPlan;
import com.hhplus.checkout.domain.subscription.SubscriptionPlanRepository;
import com.hhplus.checkout.domain.subscription.SubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * SubscriptionService - 구독 체크아웃 시작 및 조회
 *
 * 구독 레코드는 여기서 만들지 않습니다. 프로세서의 체크아웃 완료/구독 생성 이벤트가 만듭니다.
 */
@Slf4j
@Service
public class SubscriptionService {

    private static final DateTimeFormatter IDEMPOTENCY_WINDOW = DateTimeFormatter.ofPattern("yyyyMMddHHmm");

    private final SubscriptionPlanRepository planRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final PaymentProcessorClient processorClient;
    private final Clock clock;
    private final String successUrl;
    private final String cancelUrl;

    public SubscriptionService(SubscriptionPlanRepository planRepository,
                               SubscriptionRepository subscriptionRepository,
                               PaymentProcessorClient processorClient,
                               Clock clock,
                               @Value("${checkout.subscription.success-url}") String successUrl,
                               @Value("${checkout.subscription.cancel-url}") String cancelUrl) {
        this.planRepository = planRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.processorClient = processorClient;
        this.clock = clock;
        this.successUrl = successUrl;
        this.cancelUrl = cancelUrl;
    }

    /**
     * 구독 체크아웃 세션 생성. 같은 사용자/플랜/주기의 1분 내 재요청은 같은 멱등 키를 씁니다.
     */
    public SubscriptionCheckoutResult startCheckout(StartSubscriptionCommand command) {
        SubscriptionPlan plan = planRepository.findById(command.getPlanId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.PLAN_NOT_FOUND, command.getPlanId()));
        if (!plan.isActive()) {
            throw new NotFoundException(ErrorCode.PLAN_NOT_FOUND, "비활성 플랜 - planId=" + plan.getPlanId());
        }
        String priceId = plan.priceIdFor(command.getBillingCycle());
        if (priceId == null || priceId.isBlank()) {
            throw new ValidationException(ErrorCode.PLAN_PRICE_NOT_CONFIGURED,
                    "planId=" + plan.getPlanId() + ", cycle=" + command.getBillingCycle());
        }

        String idempotencyKey = "subscription-" + command.getUserId() + "-" + plan.getPlanId() + "-"
                + command.getBillingCycle() + "-" + LocalDateTime.now(clock).format(IDEMPOTENCY_WINDOW);
        SubscriptionCheckoutSession session = processorClient.createSubscriptionCheckout(
                SubscriptionCheckoutRequest.builder()
                        .priceId(priceId)
                        .userId(command.getUserId())
                        .planId(plan.getPlanId())
                        .billingCycle(command.getBillingCycle())
                        .customerEmail(command.getEmail())
                        .successUrl(successUrl)
                        .cancelUrl(cancelUrl)
                        .idempotencyKey(idempotencyKey)
                        .build());

        log.info("[SubscriptionService] 구독 체크아웃 생성 - userId={}, planId={}, cycle={}, sessionId={}",
                command.getUserId(), plan.getPlanId(), command.getBillingCycle(), session.getId());
        return new SubscriptionCheckoutResult(session.getId(), session.getUrl());
    }

    @Transactional(readOnly = true)
    public SubscriptionView getMySubscription(Long userId) {
        return subscriptionRepository.findByUserId(userId)
                .map(SubscriptionView::from)
                .orElseThrow(() -> new NotFoundException(ErrorCode.SUBSCRIPTION_NOT_FOUND, "userId=" + userId));
    }
}
