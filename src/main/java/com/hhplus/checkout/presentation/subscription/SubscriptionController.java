package com.hhplus.checkout.presentation.subscription;

import com.hhplus.checkout.application.subscription.SubscriptionService;
import com.hhplus.checkout.application.subscription.dto.StartSubscriptionCommand;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.subscription.BillingCycle;
import com.hhplus.checkout.presentation.subscription.request.SubscriptionCheckoutRequest;
import com.hhplus.checkout.presentation.subscription.response.SubscriptionCheckoutResponse;
import com.hhplus.checkout.presentation.subscription.response.SubscriptionResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * SubscriptionController - 구독 API (로그인 사용자 전용)
 */
@RestController
@RequestMapping("/subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    public SubscriptionController(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    /**
     * POST /subscriptions/checkout - 구독 결제 페이지 URL 발급
     */
    @PostMapping("/checkout")
    public ResponseEntity<SubscriptionCheckoutResponse> startCheckout(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody SubscriptionCheckoutRequest request) {
        if (request.getPlanId() == null || request.getPlanId().isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "plan_id가 필요합니다");
        }
        BillingCycle cycle = request.getBillingCycle() == null
                ? BillingCycle.MONTHLY
                : BillingCycle.fromString(request.getBillingCycle());

        SubscriptionCheckoutResponse response = SubscriptionCheckoutResponse.from(subscriptionService.startCheckout(
                new StartSubscriptionCommand(userId, request.getEmail(), request.getPlanId().trim(), cycle)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /subscriptions/me - 내 구독 조회
     */
    @GetMapping("/me")
    public ResponseEntity<SubscriptionResponse> getMySubscription(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.getMySubscription(userId)));
    }
}
