package com.example.assertdiff.infrastructure;

import com.example.assertdiff.application.LineSink;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Collects written text in memory.
 */
public class StringBuilderSink implements LineSink {
    private final StringBuilder buffer = new StringBuilder();
    private final String lineSeparator;

    public StringBuilderSink() {
        this(System.lineSeparator());
    }

    public StringBuilderSink(String lineSeparator) {
        this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
    }

    @Override
    public void write(String text) {
        buffer.append(text);
    }

    @Override
    public void writeLine(String text) {
        buffer.append(text).append(lineSeparator);
    }

    /**
     * Completed lines written so far, without separators. Text after the last separator is ignored.
     */
    public List<String> lines() {
        String text = buffer.toString();
        int end = text.lastIndexOf(lineSeparator);
        if (end < 0) {
            return List.of();
        }
        return Arrays.asList(text.substring(0, end).split(Pattern.quote(lineSeparator), -1));
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
