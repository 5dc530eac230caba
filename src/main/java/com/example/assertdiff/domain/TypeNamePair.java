package com.example.assertdiff.domain;

import java.util.Objects;

/**
 * Type names that tell apart two values which display identically.
 *
 * @param expectedName type name of the expected value
 * @param actualName   type name of the actual value
 */
public record TypeNamePair(String expectedName, String actualName) {
    public TypeNamePair {
        Objects.requireNonNull(expectedName, "expectedName");
        Objects.requireNonNull(actualName, "actualName");
    }

    /** Label appended to the formatted expected value, e.g. {@code " (Integer)"}. */
    public String expectedLabel() {
        return label(expectedName);
    }

    /** Label appended to the formatted actual value, e.g. {@code " (Long)"}. */
    public String actualLabel() {
        return label(actualName);
    }

    public boolean isDistinct() {
        return !expectedName.equals(actualName);
    }

    private static String label(String name) {
        return " (" + name + ")";
    }
}
