package com.hhplus.checkout.application.settings;

import com.hhplus.checkout.application.processor.ProcessorConfiguration;
import com.hhplus.checkout.application.processor.ProcessorCredentials;
import com.hhplus.checkout.common.exception.ErrorCode;
import com.hhplus.checkout.common.exception.ExternalProcessorException;
import com.hhplus.checkout.common.exception.ValidationException;
import com.hhplus.checkout.domain.settings.ProcessorCredential;
import com.hhplus.checkout.domain.settings.ProcessorCredentialRepository;
import com.hhplus.checkout.infrastructure.crypto.CredentialCipher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * ProcessorSettingsService - 결제 프로세서 자격 증명 관리
 *
 * 저장 시 AES-256-GCM으로 암호화하고, 저장이 끝나면 실행 중인 설정 객체를 즉시 교체합니다.
 */
@Slf4j
@Service
public class ProcessorSettingsService {

    private final ProcessorCredentialRepository credentialRepository;
    private final ProcessorConfiguration processorConfiguration;
    private final CredentialCipher credentialCipher;

    public ProcessorSettingsService(ProcessorCredentialRepository credentialRepository,
                                    ProcessorConfiguration processorConfiguration,
                                    CredentialCipher credentialCipher) {
        this.credentialRepository = credentialRepository;
        this.processorConfiguration = processorConfiguration;
        this.credentialCipher = credentialCipher;
    }

    public ProcessorSettingsView getSettings() {
        return ProcessorSettingsView.from(processorConfiguration.current());
    }

    /**
     * 스토어프런트가 결제 위젯을 띄울 때 쓰는 공개 키
     */
    public String getPublishableKey() {
        String publishableKey = processorConfiguration.current().getPublishableKey();
        if (publishableKey == null) {
            throw new ExternalProcessorException(ErrorCode.PROCESSOR_NOT_CONFIGURED);
        }
        return publishableKey;
    }

    public ProcessorSettingsView update(UpdateProcessorSettingsCommand command) {
        String publishableKey = normalize("publishableKey", command.getPublishableKey());
        String secretKey = normalize("secretKey", command.getSecretKey());
        String webhookSecret = normalize("webhookSecret", command.getWebhookSecret());
        if (publishableKey == null && secretKey == null && webhookSecret == null) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "변경할 값이 없습니다");
        }

        ProcessorCredentials merged = processorConfiguration.current().merge(publishableKey, secretKey, webhookSecret);
        credentialRepository.save(ProcessorCredential.of(
                encrypt(merged.getPublishableKey()),
                encrypt(merged.getSecretKey()),
                encrypt(merged.getWebhookSecret())));
        processorConfiguration.reconfigure(merged);

        log.info("[ProcessorSettingsService] 프로세서 자격 증명 변경 - publishableKey={}, secretKey={}, webhookSecret={}",
                publishableKey != null, secretKey != null, webhookSecret != null);
        return ProcessorSettingsView.from(merged);
    }

    /**
     * 저장된 자격 증명을 복호화해 실행 중인 설정에 반영합니다. 저장된 값이 없으면 false.
     */
    public boolean loadStoredCredentials() {
        return credentialRepository.find()
                .map(stored -> {
                    ProcessorCredentials current = processorConfiguration.current();
                    processorConfiguration.reconfigure(current.merge(
                            decrypt(stored.getEncryptedPublishableKey()),
                            decrypt(stored.getEncryptedSecretKey()),
                            decrypt(stored.getEncryptedWebhookSecret())));
                    return true;
                })
                .orElse(false);
    }

    private String normalize(String field, String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, field + "는 빈 값일 수 없습니다");
        }
        return trimmed;
    }

    private String encrypt(String value) {
        return value == null ? null : credentialCipher.encrypt(value);
    }

    private String decrypt(String value) {
        return value == null ? null : credentialCipher.decrypt(value);
    }
}
