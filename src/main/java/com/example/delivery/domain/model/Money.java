package com.example.delivery.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Value Object representing an amount held in integer minor currency units (cents).
 */
public final class Money {

    private static final int MAJOR_UNIT_SCALE = 2;

    private final long cents;

    private Money(long cents) {
        this.cents = cents;
    }

    /**
     * Creates Money from an amount in minor currency units.
     *
     * @param cents the amount in cents
     * @return new Money instance
     * @throws IllegalArgumentException if amount is negative
     */
    public static Money ofCents(long cents) {
        if (cents < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + cents);
        }
        return new Money(cents);
    }

    /**
     * Creates Money with zero amount.
     *
     * @return new Money instance with zero amount
     */
    public static Money zero() {
        return new Money(0);
    }

    /**
     * Adds another Money to this one.
     *
     * @param other the Money to add
     * @return new Money with the sum
     */
    public Money add(Money other) {
        Objects.requireNonNull(other, "Cannot add null Money");
        return new Money(Math.addExact(this.cents, other.cents));
    }

    public boolean isZero() {
        return cents == 0;
    }

    public boolean isPositive() {
        return cents > 0;
    }

    public long getCents() {
        return cents;
    }

    /**
     * Converts the amount to major currency units, e.g. 2500 cents to 25.00.
     */
    public BigDecimal toMajorUnits() {
        return BigDecimal.valueOf(cents).movePointLeft(MAJOR_UNIT_SCALE).setScale(MAJOR_UNIT_SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * Formats the amount in major units with two decimals, e.g. {@code "25.00"}.
     */
    public String toMajorUnitsString() {
        return toMajorUnits().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return cents == money.cents;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(cents);
    }

    @Override
    public String toString() {
        return toMajorUnitsString();
    }
}
