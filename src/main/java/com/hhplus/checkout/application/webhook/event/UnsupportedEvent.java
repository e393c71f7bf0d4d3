package com.hhplus.checkout.application.webhook.event;

import java.time.Instant;

/**
 * 처리하지 않는 유형. 수신 확인(200)만 하고 원장에 IGNORED로 남깁니다.
 */
public class UnsupportedEvent extends ProcessorEvent {

    public UnsupportedEvent(String eventId, String rawType, Instant createdAt) {
        super(eventId, rawType, createdAt);
    }

    @Override
    public ProcessorEventType getType() {
        return ProcessorEventType.UNSUPPORTED;
    }
}
