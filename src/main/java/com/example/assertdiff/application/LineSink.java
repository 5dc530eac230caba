package com.example.assertdiff.application;

/**
 * Character target that failure messages are written to.
 */
public interface LineSink {
    void write(String text);

    void writeLine(String text);

    default void writeLine() {
        writeLine("");
    }
}
