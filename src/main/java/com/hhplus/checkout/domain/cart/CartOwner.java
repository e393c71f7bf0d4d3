package com.hhplus.checkout.domain.cart;

import java.util.Objects;

/**
 * 장바구니 소유자
 *
 * 로그인 사용자(userId) 또는 비로그인 세션 토큰(sessionId) 중 정확히 하나를 가집니다.
 * 로그인 사용자가 있으면 세션 토큰보다 우선합니다.
 */
public final class CartOwner {

    private final Long userId;
    private final String sessionId;

    private CartOwner(Long userId, String sessionId) {
        this.userId = userId;
        this.sessionId = sessionId;
    }

    public static CartOwner ofUser(Long userId) {
        if (userId == null || userId <= 0) {
            throw new IllegalArgumentException("유효하지 않은 사용자 ID입니다: " + userId);
        }
        return new CartOwner(userId, null);
    }

    public static CartOwner ofSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("세션 토큰이 비어 있습니다");
        }
        return new CartOwner(null, sessionId.trim());
    }

    public boolean isUser() {
        return userId != null;
    }

    public Long getUserId() {
        return userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * 분산락 키 조각 (예: "user:10", "session:abc")
     */
    public String lockKey() {
        return isUser() ? "user:" + userId : "session:" + sessionId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CartOwner that = (CartOwner) o;
        return Objects.equals(userId, that.userId) && Objects.equals(sessionId, that.sessionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, sessionId);
    }

    @Override
    public String toString() {
        return "CartOwner(" + lockKey() + ")";
    }
}
