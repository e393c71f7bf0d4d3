package com.hhplus.checkout.application.checkout;

import com.hhplus.checkout.domain.common.vo.Money;
import com.hhplus.checkout.domain.order.OrderStatus;
import lombok.Builder;
import lombok.Getter;

/**
 * 체크아웃 결과. clientSecret으로 클라이언트가 프로세서 결제를 완료합니다.
 */
@Getter
@Builder
public class CheckoutResult {
    private final Long orderId;
    private final String orderNumber;
    private final OrderStatus status;
    private final Money subtotal;
    private final Money total;
    private final String chargeIntentId;
    private final String clientSecret;
}
