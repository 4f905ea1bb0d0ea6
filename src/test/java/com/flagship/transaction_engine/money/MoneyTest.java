package com.flagship.transaction_engine.money;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Values are normalized to two decimal places")
    void testNormalizesScale() {
        assertEquals(new BigDecimal("10.00"), Money.of("10").toBigDecimal());
        assertEquals(new BigDecimal("10.50"), Money.of("10.5").toBigDecimal());
        assertEquals(Money.of("10.0"), Money.of("10.00"));
        assertEquals(Money.of("10.0").hashCode(), Money.of("10.00").hashCode());
        assertEquals("10.50", Money.of("10.5").toString());
    }

    @Test
    @DisplayName("Negative values are rejected")
    void testRejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> Money.of("-0.01"));
    }

    @Test
    @DisplayName("More than two decimal places is rejected, not rounded")
    void testRejectsExcessPrecision() {
        assertThrows(IllegalArgumentException.class, () -> Money.of("1.005"));
        // trailing zeros beyond the scale carry no extra precision
        assertEquals(Money.of("1.5"), Money.of("1.5000"));
    }

    @Test
    @DisplayName("Amounts beyond the storage precision are rejected")
    void testRejectsOutOfRange() {
        assertEquals(new BigDecimal("99999999999999999.99"), Money.of("99999999999999999.99").toBigDecimal());
        assertThrows(IllegalArgumentException.class, () -> Money.of("100000000000000000"));
        assertThrows(IllegalArgumentException.class, () -> Money.of("1E+30"));
        // exponent at the edge of int range, must not overflow the digit count
        assertThrows(IllegalArgumentException.class, () -> Money.of("1E+2147483647"));
        assertThrows(IllegalArgumentException.class, () -> Money.of("1E-2147483647"));
    }

    @Test
    @DisplayName("Addition past the storage precision fails")
    void testPlusBounded() {
        Money max = Money.of("99999999999999999.99");

        assertThrows(IllegalArgumentException.class, () -> max.plus(Money.of("0.01")));
    }

    @Test
    @DisplayName("Null and non-numeric input are rejected")
    void testRejectsMissingOrGarbage() {
        assertThrows(IllegalArgumentException.class, () -> Money.of((BigDecimal) null));
        assertThrows(IllegalArgumentException.class, () -> Money.of((String) null));
        assertThrows(IllegalArgumentException.class, () -> Money.of("ten"));
    }

    @Test
    @DisplayName("Subtraction that would go negative fails instead of clamping")
    void testMinusNeverNegative() {
        Money balance = Money.of("50.00");

        assertEquals(Money.ZERO, balance.minus(Money.of("50")));
        assertEquals(Money.of("20.00"), balance.minus(Money.of("30")));
        assertThrows(IllegalArgumentException.class, () -> balance.minus(Money.of("50.01")));
    }

    @Test
    void testComparisons() {
        assertTrue(Money.of("49.99").isLessThan(Money.of("50")));
        assertFalse(Money.of("50").isLessThan(Money.of("50.00")));
        assertFalse(Money.ZERO.isPositive());
        assertTrue(Money.of("0.01").isPositive());
        assertEquals(Money.of("150.00"), Money.of("100").plus(Money.of("50")));
    }
}
