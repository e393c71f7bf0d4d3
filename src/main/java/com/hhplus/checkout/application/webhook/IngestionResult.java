package com.hhplus.checkout.application.webhook;

/**
 * 이벤트 수신 결과. 어느 경우든 송신자에게는 200으로 응답합니다.
 */
public enum IngestionResult {
    /** 상태 변경 반영 */
    APPLIED,
    /** 처리 대상이 아니거나 이미 반영된 상태 (원장에는 기록) */
    IGNORED,
    /** 플랜/사용자를 확정하지 못해 버림 (원장에는 기록) */
    UNRESOLVED,
    /** 이미 처리된 event_id */
    DUPLICATE
}
