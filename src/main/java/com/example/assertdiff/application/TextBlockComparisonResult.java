package com.example.assertdiff.application;

import java.util.List;
import java.util.Objects;

/**
 * Result of comparing two multi-line texts. Instead of printing both texts in full,
 * the Expected and But was lines summarise them and a line diff follows.
 */
public class TextBlockComparisonResult implements ComparisonResult {
    private static final String DIFF_LABEL = "text";

    private final String expected;
    private final String actual;
    private final DiffRenderer diffRenderer;
    private final int contextSize;

    public TextBlockComparisonResult(String expected, String actual, DiffRenderer diffRenderer, int contextSize) {
        this.expected = Objects.requireNonNull(expected, "expected");
        this.actual = Objects.requireNonNull(actual, "actual");
        this.diffRenderer = Objects.requireNonNull(diffRenderer, "diffRenderer");
        this.contextSize = Math.max(0, contextSize);
    }

    @Override
    public String description() {
        return "text of " + describeLines(expected);
    }

    @Override
    public Object actualValue() {
        return actual;
    }

    @Override
    public void writeActualValueTo(MessageWriter writer) {
        writer.write("text of " + describeLines(actual));
    }

    @Override
    public void writeAdditionalLinesTo(MessageWriter writer) {
        List<String> diff = diffRenderer.render(DIFF_LABEL, expected, actual, contextSize);
        for (String line : diff) {
            writer.writeMessageLine(1, line);
        }
    }

    static int lineCount(String text) {
        return DiffRenderer.lines(text).size();
    }

    private static String describeLines(String text) {
        int count = lineCount(text);
        return count == 1 ? "1 line" : count + " lines";
    }
}
