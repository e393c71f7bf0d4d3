package com.hhplus.checkout.domain.common.vo;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;
import java.util.Objects;

/**
 * Money Value Object
 *
 * 통화 단위의 최소 단위(minor unit, 예: USD의 cent)를 long으로 보관하는 값 객체입니다.
 * 부동소수점 연산을 사용하지 않으며, 모든 금액 계산은 이 객체를 통해 수행됩니다.
 *
 * 사용처:
 * - Order (subtotal, tax, shipping, discount, total)
 * - OrderItem (unitPrice, lineTotal)
 * - Payment (amount, refundedAmount)
 * - 장바구니 합계, 환불 금액
 *
 * 특징:
 * - Immutable: 생성 후 변경 불가능
 * - 0 이상의 금액만 허용
 * - 서로 다른 통화끼리의 연산/비교는 IllegalArgumentException
 * - 소수 문자열 변환은 통화의 소수 자릿수를 정확히 따르며 반올림하지 않음
 */
public final class Money implements Comparable<Money>, Serializable {
    private static final long serialVersionUID = 1L;

    private final long amount;
    private final String currency;

    private Money(long amount, String currency) {
        if (amount < 0) {
            throw new IllegalArgumentException("금액은 음수가 될 수 없습니다: " + amount);
        }
        this.amount = amount;
        this.currency = normalizeCurrency(currency);
    }

    /**
     * 최소 단위 금액으로 생성합니다.
     *
     * @param minorAmount 최소 단위 금액 (예: 2500 = 25.00 USD)
     * @param currency    ISO 4217 통화 코드
     */
    public static Money ofMinor(long minorAmount, String currency) {
        return new Money(minorAmount, currency);
    }

    public static Money zero(String currency) {
        return new Money(0L, currency);
    }

    /**
     * 10진수 금액을 정확히 변환합니다.
     *
     * @throws IllegalArgumentException 통화 소수 자릿수를 초과하는 값(예: USD 10.005), 범위를 넘는 값 또는 음수
     */
    public static Money of(BigDecimal decimalAmount, String currency) {
        Objects.requireNonNull(decimalAmount, "decimalAmount는 null이 될 수 없습니다");
        String code = normalizeCurrency(currency);
        int fractionDigits = fractionDigits(code);
        BigDecimal minor;
        try {
            minor = decimalAmount.setScale(fractionDigits, RoundingMode.UNNECESSARY)
                    .movePointRight(fractionDigits);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    String.format("%s 금액은 소수점 %d자리까지만 허용됩니다: %s", code, fractionDigits, decimalAmount.toPlainString()));
        }
        try {
            return new Money(minor.longValueExact(), code);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("표현할 수 있는 최대 금액을 초과했습니다: " + decimalAmount.toPlainString());
        }
    }

    public static Money parse(String decimalAmount, String currency) {
        if (decimalAmount == null || decimalAmount.isBlank()) {
            throw new IllegalArgumentException("금액이 비어 있습니다");
        }
        try {
            return of(new BigDecimal(decimalAmount.trim()), currency);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("금액 형식이 올바르지 않습니다: " + decimalAmount);
        }
    }

    /**
     * 최소 단위 금액을 반환합니다.
     */
    public long getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(amount).movePointLeft(fractionDigits(currency));
    }

    /**
     * "50.00" 형태의 문자열 (API 응답용)
     */
    public String toDecimalString() {
        return toDecimal().setScale(fractionDigits(currency), RoundingMode.UNNECESSARY).toPlainString();
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(Math.addExact(this.amount, other.amount), currency);
    }

    /**
     * @throws IllegalArgumentException 결과가 음수가 되는 경우
     */
    public Money subtract(Money other) {
        requireSameCurrency(other);
        long result = this.amount - other.amount;
        if (result < 0) {
            throw new IllegalArgumentException(
                String.format("음수 금액이 될 수 없습니다: %d - %d = %d", this.amount, other.amount, result)
            );
        }
        return new Money(result, currency);
    }

    public Money multiply(long quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("배수는 음수가 될 수 없습니다: " + quantity);
        }
        return new Money(Math.multiplyExact(this.amount, quantity), currency);
    }

    public boolean isGreaterThan(Money other) {
        requireSameCurrency(other);
        return this.amount > other.amount;
    }

    public boolean isGreaterThanOrEqual(Money other) {
        requireSameCurrency(other);
        return this.amount >= other.amount;
    }

    public boolean isLessThanOrEqual(Money other) {
        requireSameCurrency(other);
        return this.amount <= other.amount;
    }

    public boolean isZero() {
        return this.amount == 0;
    }

    public boolean isPositive() {
        return this.amount > 0;
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return Long.compare(this.amount, other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount == money.amount && currency.equals(money.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, currency);
    }

    @Override
    public String toString() {
        return "Money(" + toDecimalString() + " " + currency + ")";
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        if (!this.currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                    String.format("통화가 다른 금액은 연산할 수 없습니다: %s vs %s", this.currency, other.currency));
        }
    }

    private static String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("통화 코드는 필수입니다");
        }
        String code = currency.trim().toUpperCase(Locale.ROOT);
        try {
            Currency.getInstance(code);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("지원하지 않는 통화 코드입니다: " + currency);
        }
        return code;
    }

    private static int fractionDigits(String code) {
        int digits = Currency.getInstance(code).getDefaultFractionDigits();
        return Math.max(digits, 0);
    }
}
