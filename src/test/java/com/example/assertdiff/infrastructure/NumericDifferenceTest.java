package com.example.assertdiff.infrastructure;

import com.example.assertdiff.domain.DifferenceResult;
import com.example.assertdiff.domain.ToleranceMode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static com.example.assertdiff.domain.ToleranceMode.LINEAR;
import static com.example.assertdiff.domain.ToleranceMode.PERCENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NumericDifferenceTest {

    @Test
    void linearDifferenceIsSymmetric() {
        Object[][] pairs = {
                {5.0, 6.0}, {200, 210}, {-3L, 4L}, {1.5f, 0.25f}, {new BigDecimal("1.5"), new BigDecimal("2.25")}
        };
        for (Object[] pair : pairs) {
            DifferenceResult forward = NumericDifference.difference(pair[0], pair[1], LINEAR);
            DifferenceResult backward = NumericDifference.difference(pair[1], pair[0], LINEAR);
            assertEquals(forward.text(), backward.text(), () -> "pair " + pair[0] + ", " + pair[1]);
        }
    }

    @Test
    void linearDifferenceUsesWidestType() {
        assertEquals(1.0, NumericDifference.difference(5.0, 6.0, LINEAR).value());
        assertEquals(10L, NumericDifference.difference(200, 210, LINEAR).value());
        assertEquals(0.5, NumericDifference.difference(1, 1.5, LINEAR).value());
        assertEquals(1.25f, NumericDifference.difference(1.5f, 0.25f, LINEAR).value());
        assertEquals("0.75", NumericDifference.difference(new BigDecimal("1.5"), new BigDecimal("2.25"), LINEAR).text());
        assertEquals("1.0d", NumericDifference.difference(5.0, 6.0, LINEAR).text());
    }

    @Test
    void longDifferenceDoesNotOverflow() {
        DifferenceResult result = NumericDifference.difference(Long.MIN_VALUE, Long.MAX_VALUE, LINEAR);

        assertEquals(BigInteger.TWO.pow(64).subtract(BigInteger.ONE), result.value());
    }

    @Test
    void percentDifferenceIsRelativeToExpected() {
        assertEquals(5.0, NumericDifference.difference(200, 210, PERCENT).value());
        assertEquals(5.0, NumericDifference.difference(200, 190, PERCENT).value());
        assertEquals(20.0, NumericDifference.difference(5.0, 6.0, PERCENT).value());
        assertEquals("5.0d", NumericDifference.difference(200, 210, PERCENT).text());
    }

    @Test
    void percentOfBigDecimalStaysDecimal() {
        DifferenceResult result =
                NumericDifference.difference(new BigDecimal("200"), new BigDecimal("210"), PERCENT);

        assertEquals("5", result.text());
    }

    @Test
    void percentOfZeroExpectedIsComputedNotSuppressed() {
        DifferenceResult infinite = NumericDifference.difference(0, 5, PERCENT);
        DifferenceResult undefined = NumericDifference.difference(0, 0, PERCENT);

        assertFalse(infinite.isNotANumber());
        assertEquals("Infinity", infinite.text());
        assertFalse(undefined.isNotANumber());
        assertEquals("NaN", undefined.text());
    }

    @Test
    void durationsDifferAsDurations() {
        DifferenceResult result = NumericDifference.difference(Duration.ofMillis(1500), Duration.ofMillis(200), LINEAR);

        assertEquals(Duration.ofMillis(1300), result.value());
        assertEquals("PT1.3S", result.text());
    }

    @Test
    void temporalsDifferAsDurations() {
        Instant start = Instant.parse("2025-01-01T00:00:00Z");

        assertEquals(Duration.ofMinutes(90),
                NumericDifference.difference(start.plusSeconds(5400), start, LINEAR).value());
        assertEquals(Duration.ofDays(3),
                NumericDifference.difference(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 4), LINEAR).value());
    }

    @Test
    void incomparableValuesGiveSentinel() {
        assertTrue(NumericDifference.difference("5", 5, LINEAR).isNotANumber());
        assertTrue(NumericDifference.difference(null, 5, LINEAR).isNotANumber());
        assertTrue(NumericDifference.difference(Instant.EPOCH, LocalDate.EPOCH, LINEAR).isNotANumber());
        assertTrue(NumericDifference.difference(Duration.ZERO, Duration.ofSeconds(1), PERCENT).isNotANumber());
    }

    @Test
    void sentinelIsDistinctFromComputedNaN() {
        DifferenceResult computed = NumericDifference.difference(Double.NaN, 1.0, LINEAR);

        assertFalse(computed.isNotANumber());
        assertThat(computed.text()).isEqualTo("NaN");
    }

    @Test
    void otherModesHaveNoDifference() {
        assertThatThrownBy(() -> NumericDifference.difference(1.0, 2.0, ToleranceMode.ULPS))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NumericDifference.difference(1.0, 2.0, ToleranceMode.NONE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
