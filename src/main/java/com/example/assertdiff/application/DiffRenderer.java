package com.example.assertdiff.application;

import java.util.Arrays;
import java.util.List;

public interface DiffRenderer {
    List<String> render(String label, String expected, String actual, int contextSize);

    /**
     * Split text into lines on any line terminator. A terminator ends the line before it,
     * so {@code "a\n"} is one line and {@code ""} is one empty line.
     */
    static List<String> lines(String text) {
        String[] lines = text.split("\\R", -1);
        if (lines.length > 1 && lines[lines.length - 1].isEmpty()) {
            return Arrays.asList(lines).subList(0, lines.length - 1);
        }
        return Arrays.asList(lines);
    }
}
