package com.example.assertdiff.domain;

import java.util.Objects;

/**
 * Outcome of computing the difference between an expected and an actual value.
 * Values that cannot be compared numerically produce the {@link #notANumber()} sentinel,
 * which is distinct from a computed {@code NaN}.
 */
public final class DifferenceResult {
    private static final DifferenceResult NOT_A_NUMBER = new DifferenceResult(null, "NaN");

    private final Object value;
    private final String text;

    private DifferenceResult(Object value, String text) {
        this.value = value;
        this.text = text;
    }

    public static DifferenceResult of(Object value, String text) {
        return new DifferenceResult(
                Objects.requireNonNull(value, "value"), Objects.requireNonNull(text, "text"));
    }

    public static DifferenceResult notANumber() {
        return NOT_A_NUMBER;
    }

    public boolean isNotANumber() {
        return this == NOT_A_NUMBER;
    }

    /**
     * The raw difference, a {@link Number} or a {@link java.time.Duration}; {@code null} for the sentinel.
     */
    public Object value() {
        return value;
    }

    /**
     * The difference formatted for display.
     */
    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return isNotANumber() ? "DifferenceResult[not-a-number]" : "DifferenceResult[" + text + "]";
    }
}
