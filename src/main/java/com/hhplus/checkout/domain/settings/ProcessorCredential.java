package com.hhplus.checkout.domain.settings;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 결제 프로세서 자격 증명 (암호문 저장)
 *
 * 단일 행(SINGLETON_ID)만 사용합니다. 각 값은 "iv:authTag:data" base64 형식의 AES-256-GCM 암호문입니다.
 */
@Entity
@Table(name = "processor_credentials")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessorCredential {

    public static final Long SINGLETON_ID = 1L;

    @Id
    @Column(name = "credential_id")
    private Long credentialId;

    @Column(name = "encrypted_publishable_key", length = 1024)
    private String encryptedPublishableKey;

    @Column(name = "encrypted_secret_key", length = 1024)
    private String encryptedSecretKey;

    @Column(name = "encrypted_webhook_secret", length = 1024)
    private String encryptedWebhookSecret;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static ProcessorCredential of(String encryptedPublishableKey, String encryptedSecretKey,
                                         String encryptedWebhookSecret) {
        return ProcessorCredential.builder()
                .credentialId(SINGLETON_ID)
                .encryptedPublishableKey(encryptedPublishableKey)
                .encryptedSecretKey(encryptedSecretKey)
                .encryptedWebhookSecret(encryptedWebhookSecret)
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
