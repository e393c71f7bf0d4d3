package com.hhplus.checkout.application.payment;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 관리자 환불 요청
 *
 * amount가 null이면 남은 환불 가능 금액 전체를 환불합니다.
 */
@Getter
@AllArgsConstructor
public class RefundCommand {
    private final Long orderId;
    private final BigDecimal amount;
    private final String reason;
}
