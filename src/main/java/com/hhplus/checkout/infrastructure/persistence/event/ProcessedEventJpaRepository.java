package com.hhplus.checkout.infrastructure.persistence.event;

import com.hhplus.checkout.domain.event.ProcessedEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProcessedEventJpaRepository extends JpaRepository<ProcessedEvent, String> {
}
