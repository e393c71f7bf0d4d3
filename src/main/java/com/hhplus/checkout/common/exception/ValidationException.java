package com.hhplus.checkout.common.exception;

/**
 * 입력값 또는 카탈로그 상태 검증 실패 (400)
 */
public class ValidationException extends DomainException {

    public ValidationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ValidationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
