package com.hhplus.checkout.domain.event;

/**
 * 이벤트 원장 - Domain 계층 (Port)
 */
public interface ProcessedEventRepository {

    boolean existsByEventId(String eventId);

    /**
     * 즉시 INSERT(flush)합니다. 이미 기록된 event_id이면
     * org.springframework.dao.DataIntegrityViolationException을 던집니다.
     */
    ProcessedEvent insert(ProcessedEvent processedEvent);
}
