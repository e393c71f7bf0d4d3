package com.hhplus.checkout.infrastructure.persistence.event;

import com.hhplus.checkout.domain.event.ProcessedEvent;
import com.hhplus.checkout.domain.event.ProcessedEventRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

/**
 * MySQL 기반 이벤트 원장
 *
 * insert는 saveAndFlush로 즉시 INSERT하여 PK 충돌이 상태 변경보다 먼저 드러나게 합니다.
 */
@Repository
@Primary
public class MySQLProcessedEventRepository implements ProcessedEventRepository {

    private final ProcessedEventJpaRepository processedEventJpaRepository;

    public MySQLProcessedEventRepository(ProcessedEventJpaRepository processedEventJpaRepository) {
        this.processedEventJpaRepository = processedEventJpaRepository;
    }

    @Override
    public boolean existsByEventId(String eventId) {
        return processedEventJpaRepository.existsById(eventId);
    }

    @Override
    public ProcessedEvent insert(ProcessedEvent processedEvent) {
        return processedEventJpaRepository.saveAndFlush(processedEvent);
    }
}
