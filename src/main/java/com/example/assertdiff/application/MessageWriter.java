package com.example.assertdiff.application;

import com.example.assertdiff.domain.Tolerance;

/**
 * Writes the expected/actual description of a failed comparison as lines of text.
 *
 * <p>Instances hold per-call state and are not safe for concurrent use; each thread
 * rendering failures needs its own writer.
 */
public abstract class MessageWriter {

    public abstract int getMaxLineLength();

    public abstract void setMaxLineLength(int maxLineLength);

    /**
     * Write a single message line at indentation level 0.
     */
    public void writeMessageLine(String message, Object... args) {
        writeMessageLine(0, message, args);
    }

    /**
     * Write a single message line, indented by two spaces per level.
     *
     * @param level   indentation level
     * @param message the message, a {@link java.util.Formatter} pattern when {@code args} are given
     * @param args    arguments for the pattern
     * @throws com.example.assertdiff.domain.MessageFormatException if the pattern does not fit the arguments
     */
    public abstract void writeMessageLine(int level, String message, Object... args);

    /**
     * Write the Expected and But was lines for a result, followed by any lines the result adds.
     */
    public abstract void displayDifferences(ComparisonResult result);

    public void displayDifferences(Object expected, Object actual) {
        displayDifferences(expected, actual, null);
    }

    /**
     * Write Expected and But was lines for two values, plus an Off by line when a tolerance is given.
     *
     * @param tolerance the tolerance used for the comparison, or {@code null}
     */
    public abstract void displayDifferences(Object expected, Object actual, Tolerance tolerance);

    /**
     * Write two strings and, when they differ, a caret pointing at the first difference.
     *
     * @param mismatch   index of the first difference, or a negative value if unknown
     * @param ignoreCase whether the comparison ignored case
     * @param clipping   whether long strings are clipped to the line length
     */
    public abstract void displayStringDifferences(
            String expected, String actual, int mismatch, boolean ignoreCase, boolean clipping);

    public abstract void writeActualValue(Object actual);

    public abstract void writeValue(Object value);

    /**
     * Write up to {@code max} elements of a collection, starting at {@code start}.
     */
    public abstract void writeCollectionElements(Iterable<?> collection, long start, int max);

    public abstract void write(String text);

    public abstract void writeLine(String text);

    public abstract void writeLine();
}
