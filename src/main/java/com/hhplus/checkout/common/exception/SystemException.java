package com.hhplus.checkout.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 사용 예:
 * - 분산락 획득 실패
 * - 자격 증명 암복호화 실패
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
