package com.example.assertdiff.domain;

/**
 * How a tolerance amount is interpreted when two values are compared.
 */
public enum ToleranceMode {
    /** No tolerance was requested. */
    NONE("None"),
    /** The amount is an absolute difference. */
    LINEAR("Linear"),
    /** The amount is a percentage of the expected value. */
    PERCENT("Percent"),
    /** The amount is a count of units in the last place of a floating point value. */
    ULPS("Ulps");

    private final String displayName;

    ToleranceMode(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Only absolute and relative modes have a meaningful "off by" value.
     */
    public boolean rendersDifference() {
        return this == LINEAR || this == PERCENT;
    }
}
