package com.hhplus.checkout.domain.event;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * 처리 완료 이벤트 원장 - Idempotent Consumer
 *
 * 동작 원리:
 *   1. 이벤트 수신 시 event_id 존재 여부를 먼저 확인 (빠른 중복 응답)
 *   2. 없으면 상태 변경과 같은 트랜잭션에서 이 행을 INSERT
 *   3. 동시에 같은 이벤트가 들어오면 PK 충돌로 늦은 쪽이 롤백되고 중복으로 처리
 *
 * Persistable.isNew()를 항상 true로 시작해 save()가 merge가 아닌 persist로 동작하게 합니다.
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEvent implements Persistable<String> {

    @Id
    @Column(name = "event_id", nullable = false, length = 128)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "outcome", length = 16)
    @Enumerated(EnumType.STRING)
    private EventOutcome outcome;

    @Column(name = "processed_at", nullable = false)
    private LocalDateTime processedAt;

    @Transient
    private boolean isNew = true;

    public ProcessedEvent(String eventId, String eventType) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.processedAt = LocalDateTime.now();
    }

    public void complete(EventOutcome outcome) {
        this.outcome = outcome;
    }

    @Override
    public String getId() {
        return eventId;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostPersist
    @PostLoad
    void markNotNew() {
        this.isNew = false;
    }
}
