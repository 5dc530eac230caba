package com.example.assertdiff.application;

/**
 * The outcome of a failed comparison, as handed to a {@link MessageWriter}.
 * Implementations that need special rendering of their actual value, or extra
 * lines after it, override the two callbacks.
 */
public interface ComparisonResult {

    /**
     * Text describing what was expected, written verbatim.
     */
    String description();

    Object actualValue();

    default void writeActualValueTo(MessageWriter writer) {
        writer.writeActualValue(actualValue());
    }

    default void writeAdditionalLinesTo(MessageWriter writer) {
    }
}
