package com.hhplus.checkout.application.webhook;

import com.hhplus.checkout.common.exception.AuthenticityException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * 웹훅 서명 검증기
 *
 * 헤더 형식: "t=<unix seconds>,v1=<hex HMAC-SHA256>"
 * 서명 대상: "<t>." + 원본 요청 바이트
 *
 * - v1 항목이 여러 개면 하나라도 일치하면 통과 (시크릿 교체 기간)
 * - 타임스탬프가 허용 오차(기본 300초)를 벗어나면 재전송 공격으로 보고 거부
 * - 비교는 상수 시간(MessageDigest.isEqual)
 */
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SIGNATURE_SCHEME = "v1";

    private final Clock clock;
    private final long toleranceSeconds;

    public WebhookSignatureVerifier(Clock clock,
                                    @Value("${checkout.webhook.signature-tolerance-seconds:300}") long toleranceSeconds) {
        this.clock = clock;
        this.toleranceSeconds = toleranceSeconds;
    }

    /**
     * @throws AuthenticityException 헤더 누락/형식 오류, 허용 오차 초과, 서명 불일치, 시크릿 미설정
     */
    public void verify(byte[] payload, String signatureHeader, String webhookSecret) {
        if (webhookSecret == null || webhookSecret.isBlank()) {
            throw new AuthenticityException("웹훅 시크릿이 설정되지 않았습니다");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new AuthenticityException("서명 헤더가 없습니다");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split(",")) {
            int idx = part.indexOf('=');
            if (idx <= 0) {
                continue;
            }
            String key = part.substring(0, idx).trim();
            String value = part.substring(idx + 1).trim();
            if ("t".equals(key)) {
                try {
                    timestamp = Long.parseLong(value);
                } catch (NumberFormatException e) {
                    throw new AuthenticityException("서명 타임스탬프 형식이 올바르지 않습니다");
                }
            } else if (SIGNATURE_SCHEME.equals(key)) {
                signatures.add(value);
            }
        }

        if (timestamp == null || signatures.isEmpty()) {
            throw new AuthenticityException("서명 헤더 형식이 올바르지 않습니다");
        }

        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - timestamp) > toleranceSeconds) {
            throw new AuthenticityException("서명 타임스탬프가 허용 범위를 벗어났습니다 - t=" + timestamp);
        }

        byte[] expected = sign(payload, webhookSecret, timestamp).getBytes(StandardCharsets.US_ASCII);
        for (String candidate : signatures) {
            if (MessageDigest.isEqual(expected, candidate.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII))) {
                return;
            }
        }
        throw new AuthenticityException("서명이 일치하지 않습니다");
    }

    /**
     * "<timestamp>.<payload>"의 HMAC-SHA256 hex 문자열
     */
    public static String sign(byte[] payload, String secret, long timestamp) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            mac.update((timestamp + ".").getBytes(StandardCharsets.UTF_8));
            mac.update(payload);
            return HexFormat.of().formatHex(mac.doFinal());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC 계산에 실패했습니다", e);
        }
    }

    public static String header(byte[] payload, String secret, long timestamp) {
        return "t=" + timestamp + "," + SIGNATURE_SCHEME + "=" + sign(payload, secret, timestamp);
    }
}
