package com.hhplus.checkout.common.exception;

/**
 * 웹훅 서명 검증 실패 (400)
 *
 * 이 예외가 발생한 이벤트는 파싱/적용 단계로 절대 넘어가지 않습니다.
 */
public class AuthenticityException extends DomainException {

    public AuthenticityException(String detailMessage) {
        super(ErrorCode.INVALID_SIGNATURE, detailMessage);
    }
}
