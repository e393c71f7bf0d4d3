package com.hhplus.checkout.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시간 의존 로직(서명 허용 오차, 주문 번호, 방치 주문 정리)이 주입받는 Clock
 *
 * 엔티티의 LocalDateTime.now()와 비교되므로 시스템 기본 시간대를 씁니다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
