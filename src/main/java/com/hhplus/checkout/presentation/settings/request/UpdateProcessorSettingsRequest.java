package com.hhplus.checkout.presentation.settings.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 프로세서 키 변경 요청 DTO. 생략한 키는 기존 값을 유지합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProcessorSettingsRequest {

    @JsonProperty("publishable_key")
    private String publishableKey;

    @JsonProperty("secret_key")
    private String secretKey;

    @JsonProperty("webhook_secret")
    private String webhookSecret;
}
