package com.hhplus.checkout.domain.subscription;

import java.util.Locale;
import java.util.Optional;

public enum BillingCycle {
    MONTHLY("month"),
    YEARLY("year");

    private final String interval;

    BillingCycle(String interval) {
        this.interval = interval;
    }

    public String getInterval() {
        return interval;
    }

    /**
     * 프로세서의 반복 주기("month", "year")로부터 결제 주기를 구합니다.
     */
    public static Optional<BillingCycle> fromInterval(String interval) {
        if (interval == null) {
            return Optional.empty();
        }
        String normalized = interval.trim().toLowerCase(Locale.ROOT);
        for (BillingCycle cycle : values()) {
            if (cycle.interval.equals(normalized)) {
                return Optional.of(cycle);
            }
        }
        return Optional.empty();
    }

    public static BillingCycle fromString(String value) {
        for (BillingCycle cycle : values()) {
            if (cycle.name().equalsIgnoreCase(value)) {
                return cycle;
            }
        }
        throw new IllegalArgumentException("알 수 없는 결제 주기: " + value);
    }
}
