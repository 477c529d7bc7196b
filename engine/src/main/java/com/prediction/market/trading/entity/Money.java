package com.prediction.market.trading.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-precision cash amount used for balances, trade sizes, fees and proceeds.
 *
 * Every value is held at {@link #SCALE} fractional digits so that thousands of
 * trades do not accumulate rounding drift. Amounts enter the engine as strings
 * or BigDecimals; there is no factory from {@code double}.
 *
 * Immutable and thread-safe.
 */
public final class Money implements Comparable<Money> {

    /**
     * Fixed scale for stored money, share and price values (8 decimal places).
     */
    public static final int SCALE = 8;

    /**
     * Default rounding mode: HALF_EVEN (banker's rounding).
     * Platform-favouring rules (fees, shares bought) round explicitly instead.
     */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING_MODE);
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new Money(amount);
    }

    /**
     * Create Money from a whole number of currency units.
     */
    public static Money of(long amount) {
        return new Money(BigDecimal.valueOf(amount));
    }

    /**
     * Create Money from String (safest for parsing user input).
     */
    public static Money of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return new Money(new BigDecimal(amount.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
    }

    /**
     * Null-tolerant variant for persisted fields that may be absent on old rows.
     */
    public static Money ofNullable(BigDecimal amount) {
        return amount == null ? ZERO : of(amount);
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    public boolean isPositive() {
        return this.amount.signum() > 0;
    }

    public boolean isNegative() {
        return this.amount.signum() < 0;
    }

    public boolean isGreaterThanOrEqualTo(Money other) {
        return this.compareTo(other) >= 0;
    }

    /**
     * Underlying BigDecimal (for persistence and curve maths).
     */
    public BigDecimal toBigDecimal() {
        return amount;
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Money money = (Money) obj;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
