package com.hhplus.checkout.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * RetryConfig - Spring Retry 설정 클래스
 *
 * 역할:
 * - @Retryable, @Recover 어노테이션 활성화
 *
 * 적용 대상:
 * - 결제 프로세서 호출 (HttpPaymentProcessorClient)
 *   네트워크 오류/타임아웃/5xx 응답만 1회 재시도하고, 4xx 응답은 즉시 실패 처리
 */
@Configuration
@EnableRetry
public class RetryConfig {
    // @Retryable, @Recover 어노테이션은 각 메서드에서 정의
}
