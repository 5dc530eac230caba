package com.example.assertdiff.application;

import java.util.Objects;

/**
 * Result of comparing two collections element by element. The actual collection is shown
 * as a window of elements around the first differing index.
 */
public class CollectionComparisonResult implements ComparisonResult {
    private final String description;
    private final Iterable<?> actual;
    private final long failurePoint;
    private final int window;

    public CollectionComparisonResult(String description, Iterable<?> actual, long failurePoint, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.description = Objects.requireNonNull(description, "description");
        this.actual = actual;
        this.failurePoint = failurePoint;
        this.window = window;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Object actualValue() {
        return actual;
    }

    public long failurePoint() {
        return failurePoint;
    }

    /**
     * First element shown, chosen so the failure point sits in the middle of the window.
     */
    public long windowStart() {
        return Math.max(0, failurePoint - window / 2);
    }

    @Override
    public void writeActualValueTo(MessageWriter writer) {
        if (actual == null) {
            writer.writeActualValue(null);
            return;
        }
        writer.writeCollectionElements(actual, windowStart(), window);
    }

    @Override
    public void writeAdditionalLinesTo(MessageWriter writer) {
        if (failurePoint >= 0) {
            writer.writeMessageLine(1, "Values differ at index [%d]", failurePoint);
        }
    }
}
