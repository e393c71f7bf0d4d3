package com.hhplus.checkout.application.checkout;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * 주문 번호 생성기
 *
 * 형식: ORD-{yyMM}-{영문 대문자/숫자 6자리} (예: ORD-2410-7KQ2ZD)
 * 유일성은 orders.order_number 유니크 제약이 최종 보장합니다.
 */
@Component
public class OrderNumberGenerator {

    private static final String PREFIX = "ORD";
    private static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int RANDOM_LENGTH = 6;
    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyMM");

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public OrderNumberGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate() {
        StringBuilder suffix = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return PREFIX + "-" + LocalDate.now(clock).format(PERIOD_FORMAT) + "-" + suffix;
    }
}
