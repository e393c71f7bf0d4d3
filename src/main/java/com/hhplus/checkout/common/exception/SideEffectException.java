package com.hhplus.checkout.common.exception;

/**
 * 결제 확정 이후 부수 효과(수강 권한 부여, 확인 메일) 실패
 *
 * 클라이언트 응답으로 나가지 않고 로그로만 남습니다.
 * 금융 상태(주문/결제)는 이 예외로 되돌려지지 않습니다.
 */
public class SideEffectException extends ApplicationException {

    private final String effect;
    private final Long orderId;

    public SideEffectException(String effect, Long orderId, Throwable cause) {
        super(ErrorCode.SIDE_EFFECT_FAILED, "effect=" + effect + ", orderId=" + orderId, cause);
        this.effect = effect;
        this.orderId = orderId;
    }

    public String getEffect() {
        return effect;
    }

    public Long getOrderId() {
        return orderId;
    }
}
