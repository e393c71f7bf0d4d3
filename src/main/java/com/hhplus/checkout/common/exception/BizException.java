package com.hhplus.checkout.common.exception;

/**
 * BizException - 비즈니스 예외의 최상위 클래스
 *
 * 예외 계층:
 * BizException (최상위)
 * ├─ DomainException (도메인 규칙 위반, 4XX)
 * │  ├─ ValidationException (400)
 * │  ├─ NotFoundException (404)
 * │  ├─ ConflictException (409)
 * │  └─ AuthenticityException (400, 서명 검증 실패)
 * ├─ ApplicationException (프로세스 실패)
 * │  ├─ ExternalProcessorException (400, 프로세서 메시지 노출)
 * │  └─ SideEffectException (로그 전용)
 * └─ SystemException (시스템 오류, 5XX)
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    public BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    public BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    public BizException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode.getMessage() + " | " + detailMessage, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }
}
