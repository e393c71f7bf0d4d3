package com.hhplus.checkout.infrastructure.lock;

/**
 * 분산락 키 생성 유틸리티
 *
 * 패턴: resource_type:resource_id
 *
 * 사용 예:
 * - @DistributedLock(key = LockKeyGenerator.CART_OWNER_KEY_TEMPLATE)
 */
public class LockKeyGenerator {

    /**
     * 장바구니 소유자 단위 락
     * 예: addProduct(CartOwner(user:10), ...) → "cart:user:10"
     */
    public static final String CART_OWNER_KEY_TEMPLATE =
            "'cart:' + #p0.lockKey()";

    private LockKeyGenerator() {
        throw new AssertionError("이 클래스는 인스턴스화될 수 없습니다");
    }
}
