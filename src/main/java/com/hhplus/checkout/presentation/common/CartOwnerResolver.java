package com.hhplus.checkout.presentation.common;

import com.hhplus.checkout.domain.cart.CartOwner;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * 요청에서 장바구니 소유자를 결정합니다.
 *
 * 1. X-USER-ID 헤더가 있으면 로그인 사용자
 * 2. 없으면 cart_session 쿠키의 세션 토큰
 * 3. 둘 다 없으면 새 세션 토큰을 발급하고 쿠키로 내려줌 (issueIfAbsent인 경우)
 */
@Component
public class CartOwnerResolver {

    public static final String USER_HEADER = "X-USER-ID";
    public static final String SESSION_COOKIE = "cart_session";
    private static final Duration SESSION_MAX_AGE = Duration.ofDays(30);

    public CartOwner resolve(HttpServletRequest request, HttpServletResponse response) {
        CartOwner owner = resolveExisting(request);
        if (owner != null) {
            return owner;
        }
        String sessionId = UUID.randomUUID().toString().replace("-", "");
        ResponseCookie cookie = ResponseCookie.from(SESSION_COOKIE, sessionId)
                .httpOnly(true)
                .path("/")
                .sameSite("Lax")
                .maxAge(SESSION_MAX_AGE)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        return CartOwner.ofSession(sessionId);
    }

    /**
     * 쿠키를 새로 발급하지 않습니다. 소유자를 알 수 없으면 null.
     */
    public CartOwner resolveExisting(HttpServletRequest request) {
        Long userId = userId(request);
        if (userId != null) {
            return CartOwner.ofUser(userId);
        }
        String sessionId = sessionId(request);
        return sessionId == null ? null : CartOwner.ofSession(sessionId);
    }

    public Long userId(HttpServletRequest request) {
        String header = request.getHeader(USER_HEADER);
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("유효하지 않은 사용자 ID입니다: " + header);
        }
    }

    public String sessionId(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (SESSION_COOKIE.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                return cookie.getValue();
            }
        }
        return null;
    }
}
