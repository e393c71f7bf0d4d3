package com.hhplus.checkout.application.processor;

import com.hhplus.checkout.domain.common.vo.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class ChargeIntentRequest {
    private final Money amount;
    private final Long orderId;
    private final String orderNumber;
    private final String idempotencyKey;
}
