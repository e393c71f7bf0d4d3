package com.hhplus.checkout.application.webhook;

/**
 * 같은 event_id의 동시 전달에서 원장 INSERT 경쟁에 진 쪽
 *
 * 트랜잭션을 롤백시키기 위한 내부 신호이며, EventIngestionGateway가 DUPLICATE로 변환합니다.
 */
public class DuplicateEventException extends RuntimeException {

    private final String eventId;

    public DuplicateEventException(String eventId, Throwable cause) {
        super("이미 처리된 이벤트입니다: " + eventId, cause);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
