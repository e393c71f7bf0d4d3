package com.hhplus.checkout.infrastructure.crypto;

/**
 * API 키 마스킹 유틸리티
 *
 * - 8자 이상: 앞 7자 + "..." + 뒤 4자 (예: "sk_live...9xYz")
 * - 8자 미만: "****"
 * - 없음: null
 */
public class KeyMasker {

    private static final String SHORT_MASK = "****";

    public static String mask(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }
        if (key.length() < 8) {
            return SHORT_MASK;
        }
        return key.substring(0, 7) + "..." + key.substring(key.length() - 4);
    }

    private KeyMasker() {
        throw new AssertionError("이 클래스는 인스턴스화될 수 없습니다");
    }
}
