package com.example.assertdiff.infrastructure;

import com.example.assertdiff.domain.DifferenceResult;
import com.example.assertdiff.domain.ToleranceMode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Computes how far an actual value is from the expected one, as an absolute
 * amount or as a percentage of the expected value.
 */
public final class NumericDifference {
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    /** Numeric kinds in increasing order of precedence when two operands are combined. */
    private enum Kind {
        INT,
        LONG,
        BIG_INTEGER,
        BIG_DECIMAL,
        FLOAT,
        DOUBLE
    }

    private NumericDifference() {
    }

    /**
     * @return the difference, or {@link DifferenceResult#notANumber()} when the operands cannot be compared
     * @throws IllegalArgumentException if {@code mode} is neither linear nor percent
     */
    public static DifferenceResult difference(Object expected, Object actual, ToleranceMode mode) {
        if (mode == null || !mode.rendersDifference()) {
            throw new IllegalArgumentException("No difference is defined for tolerance mode " + mode);
        }
        Object value;
        if (expected instanceof Number && actual instanceof Number) {
            value = mode == ToleranceMode.LINEAR
                    ? linear((Number) expected, (Number) actual)
                    : percent((Number) expected, (Number) actual);
        } else if (mode == ToleranceMode.LINEAR) {
            value = timeDifference(expected, actual);
        } else {
            value = null;
        }
        if (value == null) {
            return DifferenceResult.notANumber();
        }
        return DifferenceResult.of(value, ValueFormatter.formatValue(value));
    }

    private static Number linear(Number expected, Number actual) {
        switch (commonKind(expected, actual)) {
            case DOUBLE:
                return Math.abs(actual.doubleValue() - expected.doubleValue());
            case FLOAT:
                return Math.abs(actual.floatValue() - expected.floatValue());
            case BIG_DECIMAL:
                return toBigDecimal(actual).subtract(toBigDecimal(expected)).abs();
            case BIG_INTEGER:
                return toBigInteger(actual).subtract(toBigInteger(expected)).abs();
            case LONG:
                BigInteger difference =
                        BigInteger.valueOf(actual.longValue()).subtract(BigInteger.valueOf(expected.longValue())).abs();
                return difference.bitLength() < Long.SIZE ? (Number) difference.longValue() : difference;
            default:
                return Math.abs((long) actual.intValue() - expected.intValue());
        }
    }

    private static Number percent(Number expected, Number actual) {
        Kind kind = commonKind(expected, actual);
        if (kind == Kind.FLOAT) {
            return Math.abs(actual.floatValue() - expected.floatValue()) * 100f / Math.abs(expected.floatValue());
        }
        if ((kind == Kind.BIG_DECIMAL || kind == Kind.BIG_INTEGER) && toBigDecimal(expected).signum() != 0) {
            BigDecimal e = toBigDecimal(expected);
            BigDecimal a = toBigDecimal(actual);
            BigDecimal result = a.subtract(e).abs()
                    .multiply(ONE_HUNDRED)
                    .divide(e.abs(), MathContext.DECIMAL64)
                    .stripTrailingZeros();
            return result.scale() < 0 ? result.setScale(0) : result;
        }
        // multiply before dividing so that exact ratios such as 10/200 stay exact
        return Math.abs(actual.doubleValue() - expected.doubleValue()) * 100.0 / Math.abs(expected.doubleValue());
    }

    private static Duration timeDifference(Object expected, Object actual) {
        if (expected instanceof Duration && actual instanceof Duration) {
            return ((Duration) actual).minus((Duration) expected).abs();
        }
        if (!(expected instanceof Temporal) || !(actual instanceof Temporal)
                || expected.getClass() != actual.getClass()) {
            return null;
        }
        Temporal e = (Temporal) expected;
        Temporal a = (Temporal) actual;
        try {
            if (e.isSupported(ChronoUnit.NANOS)) {
                return Duration.between(e, a).abs();
            }
            if (e.isSupported(ChronoUnit.DAYS)) {
                return Duration.ofDays(Math.abs(ChronoUnit.DAYS.between(e, a)));
            }
        } catch (DateTimeException | ArithmeticException ex) {
            return null;
        }
        return null;
    }

    private static Kind commonKind(Number expected, Number actual) {
        Kind e = kindOf(expected);
        Kind a = kindOf(actual);
        return e.compareTo(a) >= 0 ? e : a;
    }

    private static Kind kindOf(Number n) {
        if (n instanceof Integer || n instanceof Short || n instanceof Byte || n instanceof AtomicInteger) {
            return Kind.INT;
        }
        if (n instanceof Long || n instanceof AtomicLong) {
            return Kind.LONG;
        }
        if (n instanceof BigInteger) {
            return Kind.BIG_INTEGER;
        }
        if (n instanceof BigDecimal) {
            return Kind.BIG_DECIMAL;
        }
        if (n instanceof Float) {
            return Kind.FLOAT;
        }
        return Kind.DOUBLE;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static BigInteger toBigInteger(Number n) {
        if (n instanceof BigInteger) {
            return (BigInteger) n;
        }
        return BigInteger.valueOf(n.longValue());
    }
}
