package com.hhplus.checkout.application.processor;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 프로세서가 생성한 결제 의도 (클라이언트가 결제를 완료하는 데 쓰는 client secret 포함)
 */
@Getter
@AllArgsConstructor
public class ChargeIntent {
    private final String id;
    private final String clientSecret;
}
