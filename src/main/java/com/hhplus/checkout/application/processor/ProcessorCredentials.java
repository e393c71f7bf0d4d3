package com.hhplus.checkout.application.processor;

/**
 * 결제 프로세서 자격 증명 (평문, 메모리 전용)
 *
 * toString은 마스킹된 값만 노출합니다.
 */
public final class ProcessorCredentials {

    private final String publishableKey;
    private final String secretKey;
    private final String webhookSecret;

    public ProcessorCredentials(String publishableKey, String secretKey, String webhookSecret) {
        this.publishableKey = emptyToNull(publishableKey);
        this.secretKey = emptyToNull(secretKey);
        this.webhookSecret = emptyToNull(webhookSecret);
    }

    public static ProcessorCredentials empty() {
        return new ProcessorCredentials(null, null, null);
    }

    public String getPublishableKey() {
        return publishableKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public boolean hasSecretKey() {
        return secretKey != null;
    }

    public boolean hasWebhookSecret() {
        return webhookSecret != null;
    }

    /**
     * 결제 생성이 가능한 상태인지 (공개 키 + 비밀 키)
     */
    public boolean isConfigured() {
        return publishableKey != null && secretKey != null;
    }

    public ProcessorCredentials merge(String publishableKey, String secretKey, String webhookSecret) {
        return new ProcessorCredentials(
                publishableKey != null ? publishableKey : this.publishableKey,
                secretKey != null ? secretKey : this.secretKey,
                webhookSecret != null ? webhookSecret : this.webhookSecret);
    }

    private static String emptyToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString() {
        return "ProcessorCredentials(publishableKey=" + (publishableKey != null)
                + ", secretKey=" + (secretKey != null)
                + ", webhookSecret=" + (webhookSecret != null) + ")";
    }
}
