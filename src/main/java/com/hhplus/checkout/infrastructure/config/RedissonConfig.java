package com.hhplus.checkout.infrastructure.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 설정 (분산 락)
 *
 * application.yml의 spring.data.redis 값을 읽어 RedissonClient Bean을 직접 구성합니다.
 *
 * 용도:
 * - 장바구니 소유자 단위 변경 직렬화
 * - 체크아웃 시 주문 생성 구간 직렬화
 */
@Configuration
public class RedissonConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String host;

    @Value("${spring.data.redis.port:6379}")
    private int port;

    @Value("${spring.data.redis.database:0}")
    private int database;

    @Value("${spring.data.redis.timeout:2000ms}")
    private String timeout;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress("redis://" + host + ":" + port)
                .setDatabase(database)
                .setTimeout(parseTimeout(timeout))
                .setConnectionPoolSize(20)
                .setConnectionMinimumIdleSize(5);

        return Redisson.create(config);
    }

    /**
     * timeout 문자열 파싱 (2000ms → 2000)
     */
    private int parseTimeout(String timeout) {
        return Integer.parseInt(timeout.replace("ms", "").trim());
    }
}
