package com.hhplus.checkout.application.subscription.plan;

import com.hhplus.checkout.domain.subscription.SubscriptionPlan;
import com.hhplus.checkout.domain.subscription.SubscriptionPlanRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 3순위: 청구 상품명과 활성 플랜 slug의 단어 단위 일치
 *
 * "Pro Plan (Monthly)"은 slug "pro"와 일치하지만 "Professional"은 일치하지 않습니다.
 * 여러 플랜이 일치하면 단어 수가 가장 많은 slug 하나를 고르고, 그것도 동률이면 해석하지 않습니다.
 * checkout.subscription.fuzzy-plan-match-enabled=false로 끌 수 있습니다.
 */
@Slf4j
@Component
@Order(3)
public class ProductNamePlanResolver implements PlanResolver {

    private final SubscriptionPlanRepository planRepository;
    private final boolean enabled;

    public ProductNamePlanResolver(SubscriptionPlanRepository planRepository,
                                   @Value("${checkout.subscription.fuzzy-plan-match-enabled:true}") boolean enabled) {
        this.planRepository = planRepository;
        this.enabled = enabled;
    }

    @Override
    public Optional<SubscriptionPlan> resolve(PlanResolutionContext context) {
        if (!enabled || context.getProductName() == null) {
            return Optional.empty();
        }
        List<String> productWords = words(context.getProductName());
        if (productWords.isEmpty()) {
            return Optional.empty();
        }

        List<SubscriptionPlan> best = new ArrayList<>();
        int bestLength = 0;
        for (SubscriptionPlan plan : planRepository.findActive()) {
            List<String> slugWords = words(plan.getSlug());
            if (slugWords.isEmpty() || Collections.indexOfSubList(productWords, slugWords) < 0) {
                continue;
            }
            if (slugWords.size() > bestLength) {
                best.clear();
                bestLength = slugWords.size();
            }
            if (slugWords.size() == bestLength) {
                best.add(plan);
            }
        }

        if (best.size() > 1) {
            log.warn("[ProductNamePlanResolver] 상품명이 여러 플랜과 일치하여 해석하지 않음 - productName={}, candidates={}",
                    context.getProductName(), best.stream().map(SubscriptionPlan::getSlug).collect(Collectors.toList()));
            return Optional.empty();
        }
        return best.stream().findFirst();
    }

    @Override
    public String name() {
        return "product-name";
    }

    static List<String> words(String value) {
        String normalized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }
}
