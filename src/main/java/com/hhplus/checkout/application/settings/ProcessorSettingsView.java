package com.hhplus.checkout.application.settings;

import com.hhplus.checkout.application.processor.ProcessorCredentials;
import com.hhplus.checkout.infrastructure.crypto.KeyMasker;
import lombok.Builder;
import lombok.Getter;

/**
 * 관리자 설정 화면용. 비밀 값은 마스킹된 형태로만 나갑니다.
 */
@Getter
@Builder
public class ProcessorSettingsView {
    private final String publishableKey;
    private final String secretKey;
    private final String webhookSecret;
    private final boolean configured;
    private final boolean webhookConfigured;

    public static ProcessorSettingsView from(ProcessorCredentials credentials) {
        return ProcessorSettingsView.builder()
                .publishableKey(KeyMasker.mask(credentials.getPublishableKey()))
                .secretKey(KeyMasker.mask(credentials.getSecretKey()))
                .webhookSecret(KeyMasker.mask(credentials.getWebhookSecret()))
                .configured(credentials.isConfigured())
                .webhookConfigured(credentials.hasWebhookSecret())
                .build();
    }
}
