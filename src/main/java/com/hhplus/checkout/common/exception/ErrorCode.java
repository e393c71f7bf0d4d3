package com.hhplus.checkout.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CART_EMPTY, APP_PROCESSOR_REQUEST_FAILED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    INVALID_REQUEST("DOMAIN_INVALID_REQUEST", "잘못된 요청입니다", 400),

    // Catalog
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    PRODUCT_NOT_AVAILABLE("DOMAIN_PRODUCT_NOT_AVAILABLE", "판매 중인 상품이 아닙니다", 400),
    VARIANT_MISMATCH("DOMAIN_PRODUCT_VARIANT_MISMATCH", "상품과 옵션이 일치하지 않습니다", 400),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 400),
    CURRENCY_MISMATCH("DOMAIN_CATALOG_CURRENCY_MISMATCH", "상점 통화와 다른 통화의 상품입니다", 400),
    COURSE_NOT_FOUND("DOMAIN_COURSE_NOT_FOUND", "강의를 찾을 수 없습니다", 404),
    COURSE_NOT_PURCHASABLE("DOMAIN_COURSE_NOT_PURCHASABLE", "구매할 수 없는 강의입니다", 400),
    COURSE_ALREADY_ENROLLED("DOMAIN_COURSE_ALREADY_ENROLLED", "이미 수강 중인 강의입니다", 409),

    // Cart
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "수량은 0 이상 1000 이하여야 합니다", 400),
    CART_LOGIN_REQUIRED("DOMAIN_CART_LOGIN_REQUIRED", "강의 구매는 로그인이 필요합니다", 400),

    // Order / Payment
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS", "현재 주문 상태에서 허용되지 않는 요청입니다", 409),
    PAYMENT_NOT_FOUND("DOMAIN_PAYMENT_NOT_FOUND", "결제 정보를 찾을 수 없습니다", 404),
    INVALID_PAYMENT_STATUS("DOMAIN_PAYMENT_INVALID_STATUS", "현재 결제 상태에서 허용되지 않는 요청입니다", 409),
    PAYMENT_NOT_REFUNDABLE("DOMAIN_PAYMENT_NOT_REFUNDABLE", "환불 가능한 결제가 아닙니다", 409),
    INVALID_REFUND_AMOUNT("DOMAIN_REFUND_INVALID_AMOUNT", "환불 금액이 올바르지 않습니다", 400),
    REFUND_EXCEEDS_REMAINING("DOMAIN_REFUND_EXCEEDS_REMAINING", "환불 금액이 환불 가능 잔액을 초과합니다", 409),

    // Subscription
    PLAN_NOT_FOUND("DOMAIN_PLAN_NOT_FOUND", "구독 플랜을 찾을 수 없습니다", 404),
    PLAN_PRICE_NOT_CONFIGURED("DOMAIN_PLAN_PRICE_NOT_CONFIGURED", "해당 결제 주기의 가격이 설정되지 않은 플랜입니다", 400),
    SUBSCRIPTION_NOT_FOUND("DOMAIN_SUBSCRIPTION_NOT_FOUND", "구독 정보를 찾을 수 없습니다", 404),

    // Webhook
    INVALID_SIGNATURE("DOMAIN_WEBHOOK_INVALID_SIGNATURE", "웹훅 서명 검증에 실패했습니다", 400),
    MALFORMED_EVENT("DOMAIN_WEBHOOK_MALFORMED_EVENT", "웹훅 이벤트 형식이 올바르지 않습니다", 400),

    // ========== Application Layer Errors ==========

    PROCESSOR_NOT_CONFIGURED("APP_PROCESSOR_NOT_CONFIGURED", "결제 프로세서가 설정되지 않았습니다", 400),
    PROCESSOR_REQUEST_FAILED("APP_PROCESSOR_REQUEST_FAILED", "결제 프로세서 요청에 실패했습니다", 400),
    SIDE_EFFECT_FAILED("APP_SIDE_EFFECT_FAILED", "결제 후속 처리에 실패했습니다", 500),

    // ========== System Errors (5XX) ==========

    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "분산락 획득에 실패했습니다", 500),
    CREDENTIAL_CRYPTO_FAILED("SYSTEM_CREDENTIAL_CRYPTO_FAILED", "자격 증명 암복호화에 실패했습니다", 500),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
