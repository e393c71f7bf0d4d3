package com.hhplus.checkout.domain.event;

/**
 * 이벤트 적용 결과 (원장에 기록)
 */
public enum EventOutcome {
    /** 상태 변경 반영 */
    APPLIED,
    /** 지원하지 않는 유형이거나 반영할 대상/변경이 없음 */
    IGNORED,
    /** 대상(플랜, 사용자 등)을 확정할 수 없어 버림 */
    UNRESOLVED
}
