package com.hhplus.checkout.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 사용 예:
 * - if (quantity > CartConstants.MAX_CART_QUANTITY) throw ...
 * - 수량 0으로 수정하면 항목 삭제와 동일하게 처리
 */
public class CartConstants {

    /** 추가 시 최소 수량 */
    public static final int MIN_ADD_QUANTITY = 1;

    /** 장바구니 항목 최대 수량 */
    public static final int MAX_CART_QUANTITY = 1000;

    /** 강의 항목 수량 (고정) */
    public static final int COURSE_QUANTITY = 1;

    /** 비로그인 장바구니 세션 쿠키 이름 */
    public static final String SESSION_COOKIE_NAME = "cart_session";

    /** 세션 쿠키 만료 (30일) */
    public static final int SESSION_COOKIE_MAX_AGE_SECONDS = 60 * 60 * 24 * 30;

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
