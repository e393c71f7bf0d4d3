package com.hhplus.checkout.application.subscription.plan;

import com.hhplus.checkout.domain.subscription.SubscriptionPlan;

import java.util.Optional;

/**
 * 구독 이벤트로부터 플랜을 찾는 전략
 *
 * 구현체는 @Order 순서대로 PlanResolutionChain에서 시도되며, 처음 찾은 결과를 사용합니다.
 * 단서가 없거나 일치하는 플랜이 없으면 empty를 반환해야 합니다 (예외 금지).
 */
public interface PlanResolver {

    Optional<SubscriptionPlan> resolve(PlanResolutionContext context);

    String name();
}
