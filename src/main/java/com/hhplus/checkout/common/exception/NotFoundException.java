package com.hhplus.checkout.common.exception;

/**
 * 리소스를 찾을 수 없음 (404)
 */
public class NotFoundException extends DomainException {

    public NotFoundException(ErrorCode errorCode) {
        super(errorCode);
    }

    public NotFoundException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public NotFoundException(ErrorCode errorCode, Object id) {
        super(errorCode, "id=" + id);
    }
}
