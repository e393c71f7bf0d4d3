package com.hhplus.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Checkout 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 결제 확정 이후 부수 효과(수강 권한, 메일)를 비동기로 실행
 * - @EnableScheduling: 방치된 PENDING 주문 정리
 * - @EnableAspectJAutoProxy: 분산락 Aspect 자동 프록시 생성
 *
 * 재시도(@EnableRetry)는 RetryConfig에서 활성화합니다.
 */
@EnableAsync
@EnableScheduling
@EnableAspectJAutoProxy
@SpringBootApplication
public class CheckoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckoutApplication.class, args);
    }

}
