package com.hhplus.checkout.domain.subscription;

import java.util.Locale;
import java.util.Optional;

/**
 * 구독 상태 (프로세서 상태 값과 1:1 대응)
 */
public enum SubscriptionStatus {
    ACTIVE("active"),
    PAST_DUE("past_due"),
    CANCELED("canceled"),
    TRIALING("trialing"),
    PAUSED("paused"),
    INCOMPLETE("incomplete"),
    INCOMPLETE_EXPIRED("incomplete_expired");

    private final String externalValue;

    SubscriptionStatus(String externalValue) {
        this.externalValue = externalValue;
    }

    public String getExternalValue() {
        return externalValue;
    }

    /**
     * 프로세서 상태 문자열을 매핑합니다. 알 수 없는 값이면 empty.
     */
    public static Optional<SubscriptionStatus> fromExternal(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SubscriptionStatus status : values()) {
            if (status.externalValue.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
