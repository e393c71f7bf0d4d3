package com.hhplus.checkout.application.webhook.event;

import java.time.Instant;

/**
 * 서명 검증과 파싱을 통과한 프로세서 이벤트
 *
 * 메타데이터 맵을 그대로 흘려보내지 않고 유형별 필드로 변환된 상태만 다룹니다.
 */
public abstract class ProcessorEvent {

    private final String eventId;
    private final String rawType;
    private final Instant createdAt;

    protected ProcessorEvent(String eventId, String rawType, Instant createdAt) {
        this.eventId = eventId;
        this.rawType = rawType;
        this.createdAt = createdAt;
    }

    public String getEventId() {
        return eventId;
    }

    public String getRawType() {
        return rawType;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public abstract ProcessorEventType getType();
}
