package com.example.assertdiff.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Objects;

/**
 * Tolerance within which a comparison was made.
 *
 * @param mode   the interpretation of {@code amount}
 * @param amount a {@link Number} or a {@link Duration}; may be {@code null} only for {@link ToleranceMode#NONE}
 */
public record Tolerance(ToleranceMode mode, Object amount) {
    private static final Tolerance NONE = new Tolerance(ToleranceMode.NONE, null);

    public Tolerance {
        Objects.requireNonNull(mode, "mode");
        if (mode != ToleranceMode.NONE) {
            Objects.requireNonNull(amount, "amount");
        }
        if (amount != null && !(amount instanceof Number) && !(amount instanceof Duration)) {
            throw new IllegalArgumentException(
                    "Tolerance amount must be numeric or a Duration, was " + amount.getClass().getName());
        }
        if (amount instanceof Duration && mode != ToleranceMode.LINEAR && mode != ToleranceMode.NONE) {
            throw new IllegalArgumentException("Duration tolerance can only be applied in linear mode");
        }
        if (mode == ToleranceMode.ULPS && !isIntegral(amount)) {
            throw new IllegalArgumentException("Ulps tolerance must be an integral amount");
        }
    }

    public static Tolerance none() {
        return NONE;
    }

    public static Tolerance exact() {
        return new Tolerance(ToleranceMode.LINEAR, 0);
    }

    public static Tolerance linear(Object amount) {
        return new Tolerance(ToleranceMode.LINEAR, amount);
    }

    public static Tolerance percent(Number amount) {
        return new Tolerance(ToleranceMode.PERCENT, amount);
    }

    public static Tolerance ulps(long amount) {
        return new Tolerance(ToleranceMode.ULPS, amount);
    }

    /**
     * Reinterpret the same amount as a percentage.
     */
    public Tolerance asPercent() {
        return new Tolerance(ToleranceMode.PERCENT, amount);
    }

    /**
     * A tolerance has variance when it has a mode and a non-zero amount.
     */
    public boolean hasVariance() {
        return mode != ToleranceMode.NONE && amount != null && !isZero(amount);
    }

    private static boolean isZero(Object amount) {
        if (amount instanceof Duration) {
            return ((Duration) amount).isZero();
        }
        if (amount instanceof BigDecimal) {
            return ((BigDecimal) amount).signum() == 0;
        }
        if (amount instanceof BigInteger) {
            return ((BigInteger) amount).signum() == 0;
        }
        return ((Number) amount).doubleValue() == 0.0;
    }

    private static boolean isIntegral(Object amount) {
        return amount instanceof Long
                || amount instanceof Integer
                || amount instanceof Short
                || amount instanceof Byte
                || amount instanceof BigInteger;
    }
}
