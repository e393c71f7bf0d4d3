package com.hhplus.checkout.presentation.order.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 환불 요청 DTO
 *
 * amount는 "20.00" 형태의 문자열이며, 생략하면 남은 금액 전체를 환불합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefundRequest {
    private String amount;
    private String reason;
}
