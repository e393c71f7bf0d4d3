package com.hhplus.checkout.presentation.settings.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.checkout.application.settings.ProcessorSettingsView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 프로세서 설정 응답 DTO (모든 키는 마스킹된 형태)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessorSettingsResponse {

    @JsonProperty("publishable_key")
    private String publishableKey;

    @JsonProperty("secret_key")
    private String secretKey;

    @JsonProperty("webhook_secret")
    private String webhookSecret;

    @JsonProperty("is_configured")
    private boolean configured;

    @JsonProperty("webhook_configured")
    private boolean webhookConfigured;

    public static ProcessorSettingsResponse from(ProcessorSettingsView view) {
        return ProcessorSettingsResponse.builder()
                .publishableKey(view.getPublishableKey())
                .secretKey(view.getSecretKey())
                .webhookSecret(view.getWebhookSecret())
                .configured(view.isConfigured())
                .webhookConfigured(view.isWebhookConfigured())
                .build();
    }
}
