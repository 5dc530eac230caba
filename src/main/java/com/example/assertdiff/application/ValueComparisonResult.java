package com.example.assertdiff.application;

import java.util.Objects;

public record ValueComparisonResult(String description, Object actualValue) implements ComparisonResult {
    public ValueComparisonResult {
        Objects.requireNonNull(description, "description");
    }
}
