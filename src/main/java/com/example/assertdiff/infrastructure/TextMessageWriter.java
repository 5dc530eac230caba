package com.example.assertdiff.infrastructure;

import com.example.assertdiff.application.ComparisonResult;
import com.example.assertdiff.application.LineSink;
import com.example.assertdiff.application.MessageWriter;
import com.example.assertdiff.domain.ClippedPair;
import com.example.assertdiff.domain.DifferenceResult;
import com.example.assertdiff.domain.MessageFormatException;
import com.example.assertdiff.domain.RenderState;
import com.example.assertdiff.domain.Tolerance;
import com.example.assertdiff.domain.ToleranceMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes failure messages in the standard Expected / But was / Off by layout:
 *
 * <pre>
 *   Expected: 5.0d +/- 0.05d
 *   But was:  6.0d
 *   Off by:   1.0d
 * </pre>
 *
 * String differences get a caret line pointing at the first mismatching character.
 */
public class TextMessageWriter extends MessageWriter {
    private static final Logger log = LogManager.getLogger(TextMessageWriter.class);

    public static final int DEFAULT_LINE_LENGTH = 78;

    /** Width of every line prefix. Values and carets are aligned against it. */
    public static final int PREFIX_LENGTH = 12;

    public static final String PFX_EXPECTED = prefix("Expected:");
    public static final String PFX_ACTUAL = prefix("But was:");
    public static final String PFX_DIFFERENCE = prefix("Off by:");

    /** Shortest line that still leaves room for a clipped value with both ellipses. */
    public static final int MIN_LINE_LENGTH = PREFIX_LENGTH + 2 + 10;

    private final LineSink sink;
    private final TypeNameDifferenceResolver typeNameResolver;
    private int maxLineLength = DEFAULT_LINE_LENGTH;
    private RenderState state = RenderState.idle();

    public TextMessageWriter() {
        this(new StringBuilderSink());
    }

    public TextMessageWriter(LineSink sink) {
        this(sink, new TypeNameDifferenceResolver());
    }

    public TextMessageWriter(LineSink sink, TypeNameDifferenceResolver typeNameResolver) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.typeNameResolver = Objects.requireNonNull(typeNameResolver, "typeNameResolver");
    }

    /**
     * Create a writer whose output starts with a user message, if one is given.
     */
    public TextMessageWriter(LineSink sink, String userMessage, Object... args) {
        this(sink);
        if (userMessage != null && !userMessage.isEmpty()) {
            writeMessageLine(userMessage, args);
        }
    }

    private static String prefix(String label) {
        if (label.length() + 3 > PREFIX_LENGTH) {
            throw new IllegalStateException("Prefix label too long: " + label);
        }
        return "  " + label + " ".repeat(PREFIX_LENGTH - 2 - label.length());
    }

    @Override
    public int getMaxLineLength() {
        return maxLineLength;
    }

    @Override
    public void setMaxLineLength(int maxLineLength) {
        if (maxLineLength < MIN_LINE_LENGTH) {
            throw new IllegalArgumentException(
                    "Line length must be at least " + MIN_LINE_LENGTH + ", was " + maxLineLength);
        }
        this.maxLineLength = maxLineLength;
    }

    RenderState getState() {
        return state;
    }

    @Override
    public void writeMessageLine(int level, String message, Object... args) {
        if (message == null) {
            return;
        }
        String text = message;
        if (args != null && args.length > 0) {
            try {
                text = String.format(Locale.ROOT, message, args);
            } catch (IllegalFormatException e) {
                throw new MessageFormatException(message, args.length, e);
            }
        }
        writeLine(" ".repeat(2 * Math.max(0, level)) + ValueFormatter.escapeNullCharacters(text));
    }

    @Override
    public void displayDifferences(ComparisonResult result) {
        state = RenderState.idle();
        writeExpectedLine(result);
        writeActualLine(result);
        result.writeAdditionalLinesTo(this);
    }

    @Override
    public void displayDifferences(Object expected, Object actual, Tolerance tolerance) {
        // values may be one-shot sequences, so each is formatted exactly once
        String expectedText = ValueFormatter.formatValue(expected);
        String actualText = ValueFormatter.formatValue(actual);
        state = resolveState(expected, actual, expectedText, actualText);
        try {
            writeExpectedLine(expectedText, tolerance);
            writeActualLine(actualText);
            if (tolerance != null) {
                writeDifferenceLine(expected, actual, tolerance);
            }
        } finally {
            state = RenderState.idle();
        }
    }

    @Override
    public void displayStringDifferences(
            String expected, String actual, int mismatch, boolean ignoreCase, boolean clipping) {
        state = RenderState.idle();
        // room left after the prefix and the two quotation marks
        int maxDisplayLength = maxLineLength - PREFIX_LENGTH - 2;

        if (clipping) {
            int clipAround = mismatch >= 0 ? mismatch : StringDiffRenderer.findMismatch(expected, actual, 0, ignoreCase);
            ClippedPair clipped = StringDiffRenderer.clip(expected, actual, maxDisplayLength, clipAround);
            if (!clipped.expected().equals(expected) || !clipped.actual().equals(actual)) {
                log.debug("Clipped strings of length {} and {} around index {}",
                        expected.length(), actual.length(), clipAround);
            }
            expected = clipped.expected();
            actual = clipped.actual();
        }

        expected = ValueFormatter.escapeControlChars(expected);
        actual = ValueFormatter.escapeControlChars(actual);

        // clipping and escaping both move characters, so the caller's index is stale
        mismatch = StringDiffRenderer.findMismatch(expected, actual, 0, ignoreCase);

        write(PFX_EXPECTED);
        write(ValueFormatter.formatEscapedString(expected));
        if (ignoreCase) {
            write(", ignoring case");
        }
        writeLine();
        write(PFX_ACTUAL);
        write(ValueFormatter.formatEscapedString(actual));
        writeLine();
        if (mismatch >= 0) {
            writeLine(StringDiffRenderer.caretLine(PREFIX_LENGTH, mismatch));
        }
    }

    @Override
    public void writeActualValue(Object actual) {
        writeValue(actual);
    }

    @Override
    public void writeValue(Object value) {
        write(ValueFormatter.formatValue(value));
    }

    @Override
    public void writeCollectionElements(Iterable<?> collection, long start, int max) {
        write(ValueFormatter.formatCollection(collection, start, max));
    }

    @Override
    public void write(String text) {
        sink.write(text);
    }

    @Override
    public void writeLine(String text) {
        sink.writeLine(text);
    }

    @Override
    public void writeLine() {
        sink.writeLine();
    }

    /**
     * The text written so far, when the sink keeps it in memory.
     */
    @Override
    public String toString() {
        return sink.toString();
    }

    private RenderState resolveState(Object expected, Object actual, String expectedText, String actualText) {
        if (expected != null
                && actual != null
                && expected.getClass() != actual.getClass()
                && expectedText.equals(actualText)) {
            RenderState rendering = RenderState.rendering(typeNameResolver.resolve(expected, actual));
            log.debug("Values display identically, adding type names: {}", rendering);
            return rendering;
        }
        return RenderState.idle();
    }

    private void writeExpectedLine(ComparisonResult result) {
        write(PFX_EXPECTED);
        writeLine(String.valueOf(result.description()));
    }

    private void writeExpectedLine(String expectedText, Tolerance tolerance) {
        write(PFX_EXPECTED);
        write(expectedText);
        write(state.expectedTypeLabel());
        if (tolerance != null && tolerance.hasVariance()) {
            write(" +/- ");
            write(ValueFormatter.formatValue(tolerance.amount()));
            if (tolerance.mode() != ToleranceMode.LINEAR) {
                write(" " + tolerance.mode().displayName());
            }
        }
        writeLine();
    }

    private void writeActualLine(ComparisonResult result) {
        write(PFX_ACTUAL);
        result.writeActualValueTo(this);
        writeLine();
    }

    private void writeActualLine(String actualText) {
        write(PFX_ACTUAL);
        write(actualText);
        write(state.actualTypeLabel());
        writeLine();
    }

    private void writeDifferenceLine(Object expected, Object actual, Tolerance tolerance) {
        if (!tolerance.mode().rendersDifference()) {
            return;
        }
        DifferenceResult difference = NumericDifference.difference(expected, actual, tolerance.mode());
        if (difference.isNotANumber()) {
            log.debug("No numeric difference between {} and {}", expected, actual);
            return;
        }
        write(PFX_DIFFERENCE);
        write(difference.text());
        if (tolerance.mode() != ToleranceMode.LINEAR) {
            write(" " + tolerance.mode().displayName());
        }
        writeLine();
    }
}
