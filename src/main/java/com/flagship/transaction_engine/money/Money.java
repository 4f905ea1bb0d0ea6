package com.flagship.transaction_engine.money;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Non-negative monetary quantity with two fractional digits.
 *
 * Invariant: a Money instance is never negative. Arithmetic that would produce a
 * negative value is rejected, never clamped. Callers that enforce business rules
 * (the balance mutator) check {@link #isLessThan(Money)} first and raise their own
 * error; {@link #minus(Money)} failing is a programming error.
 */
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    // NUMERIC(19,2) columns
    public static final int MAX_INTEGER_DIGITS = 17;
    public static final Money ZERO = new Money(BigDecimal.ZERO.setScale(SCALE));

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount;
    }

    /**
     * Creates a Money value.
     *
     * @throws IllegalArgumentException if the value is null, negative, has more
     *                                  than two fractional digits or more than
     *                                  {@value #MAX_INTEGER_DIGITS} integer digits
     */
    @JsonCreator
    public static Money of(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + value);
        }
        BigDecimal normalized = value.stripTrailingZeros();
        if (normalized.scale() > SCALE) {
            throw new IllegalArgumentException(
                String.format("Amount %s has more than %d decimal places", value, SCALE));
        }
        // long arithmetic: scale can be close to Integer.MIN_VALUE
        long integerDigits = (long) normalized.precision() - normalized.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            throw new IllegalArgumentException(
                String.format("Amount %s has more than %d integer digits", value, MAX_INTEGER_DIGITS));
        }
        return new Money(normalized.setScale(SCALE, RoundingMode.UNNECESSARY));
    }

    public static Money of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        try {
            return of(new BigDecimal(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Amount is not a number: " + value, e);
        }
    }

    /**
     * Adds {@code other}.
     *
     * @throws IllegalArgumentException if the sum exceeds {@value #MAX_INTEGER_DIGITS} integer digits
     */
    public Money plus(Money other) {
        return of(amount.add(other.amount));
    }

    /**
     * Subtracts {@code other}.
     *
     * @throws IllegalArgumentException if the result would be negative
     */
    public Money minus(Money other) {
        BigDecimal result = amount.subtract(other.amount);
        if (result.signum() < 0) {
            throw new IllegalArgumentException(
                String.format("Cannot subtract %s from %s: result would be negative", other, this));
        }
        return new Money(result);
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    @JsonValue
    public BigDecimal toBigDecimal() {
        return amount;
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Money other)) return false;
        return amount.compareTo(other.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
