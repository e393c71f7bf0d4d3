package com.hhplus.checkout.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * 분산락 어노테이션
 *
 * 메서드에 붙여서 Redis 기반 분산락을 적용합니다.
 * Spring EL을 지원하므로 메서드 파라미터를 동적 키로 사용할 수 있습니다.
 *
 * 예제:
 * @DistributedLock(key = LockKeyGenerator.CART_OWNER_KEY_TEMPLATE)
 * public CartSummary addProduct(CartOwner owner, ...) { ... }
 *
 * 결제 프로세서 호출을 감싸는 메서드에는 사용하지 않습니다.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * Redis 분산락 키 (Spring EL)
     *
     * - #p0, #p1, ... : 메서드 파라미터 (위치 기반)
     * - "'cart:' + #p0.lockKey()" : 파라미터 객체의 메서드 호출
     */
    String key();

    /**
     * 락 획득 대기 시간 (기본값: 5초)
     */
    long waitTime() default 5;

    /**
     * 락 유지 시간 (기본값: 3초)
     */
    long leaseTime() default 3;

    TimeUnit timeUnit() default TimeUnit.SECONDS;
}
