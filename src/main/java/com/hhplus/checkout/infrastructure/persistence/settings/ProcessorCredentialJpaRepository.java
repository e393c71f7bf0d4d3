package com.hhplus.checkout.infrastructure.persistence.settings;

import com.hhplus.checkout.domain.settings.ProcessorCredential;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProcessorCredentialJpaRepository extends JpaRepository<ProcessorCredential, Long> {
}
