package com.hhplus.checkout.application.settings;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * null인 필드는 기존 값을 유지합니다.
 */
@Getter
@AllArgsConstructor
public class UpdateProcessorSettingsCommand {
    private final String publishableKey;
    private final String secretKey;
    private final String webhookSecret;
}
