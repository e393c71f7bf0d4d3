package com.hhplus.checkout.presentation.checkout.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 요청 DTO
 *
 * 비로그인 주문은 email이 필수입니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {
    private String email;
}
