package com.hhplus.checkout.application.processor;

import com.hhplus.checkout.domain.common.vo.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class ProcessorRefundRequest {
    private final String chargeIntentId;
    private final Money amount;
    private final String reason;
    private final String idempotencyKey;
}
