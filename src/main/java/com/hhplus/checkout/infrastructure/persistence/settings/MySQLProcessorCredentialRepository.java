package com.hhplus.checkout.infrastructure.persistence.settings;

import com.hhplus.checkout.domain.settings.ProcessorCredential;
import com.hhplus.checkout.domain.settings.ProcessorCredentialRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 프로세서 자격 증명 저장소 (단일 행, credential_id = 1)
 */
@Repository
@Primary
public class MySQLProcessorCredentialRepository implements ProcessorCredentialRepository {

    private final ProcessorCredentialJpaRepository processorCredentialJpaRepository;

    public MySQLProcessorCredentialRepository(ProcessorCredentialJpaRepository processorCredentialJpaRepository) {
        this.processorCredentialJpaRepository = processorCredentialJpaRepository;
    }

    @Override
    public Optional<ProcessorCredential> find() {
        return processorCredentialJpaRepository.findById(ProcessorCredential.SINGLETON_ID);
    }

    @Override
    public ProcessorCredential save(ProcessorCredential credential) {
        return processorCredentialJpaRepository.save(credential);
    }
}
