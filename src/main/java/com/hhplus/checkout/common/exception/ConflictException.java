package com.hhplus.checkout.common.exception;

/**
 * 현재 상태와 충돌하는 요청 (409)
 *
 * 사용 예:
 * - 환불 가능 잔액 초과
 * - 허용되지 않는 주문/결제 상태 전이
 * - 이미 수강 중인 강의 구매
 */
public class ConflictException extends DomainException {

    public ConflictException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ConflictException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
