package com.example.assertdiff.infrastructure;

import com.example.assertdiff.application.LineSink;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Streams text to a {@link Writer} line by line. Write failures abort the rendering call
 * with an {@link UncheckedIOException} carrying the writer's exception.
 */
public class WriterSink implements LineSink {
    private final Writer writer;
    private final String lineSeparator;

    public WriterSink(Writer writer) {
        this(writer, System.lineSeparator());
    }

    public WriterSink(Writer writer, String lineSeparator) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
    }

    @Override
    public void write(String text) {
        try {
            writer.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write failure message", e);
        }
    }

    @Override
    public void writeLine(String text) {
        write(text + lineSeparator);
    }

    public void flush() {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush failure message", e);
        }
    }
}
