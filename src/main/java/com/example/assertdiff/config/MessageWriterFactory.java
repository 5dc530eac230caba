package com.example.assertdiff.config;

import com.example.assertdiff.application.ComparisonResult;
import com.example.assertdiff.application.DiffRenderer;
import com.example.assertdiff.application.LineSink;
import com.example.assertdiff.application.TextBlockComparisonResult;
import com.example.assertdiff.domain.Tolerance;
import com.example.assertdiff.infrastructure.StringBuilderSink;
import com.example.assertdiff.infrastructure.TextMessageWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Hands out configured writers. Writers keep per-call state, so every rendering gets a new one.
 */
@Component
public class MessageWriterFactory {
    private static final Logger log = LogManager.getLogger(MessageWriterFactory.class);

    private final DisplaySettings settings;
    private final DiffRenderer diffRenderer;

    public MessageWriterFactory(DisplaySettings settings, DiffRenderer diffRenderer) {
        this.settings = settings;
        this.diffRenderer = diffRenderer;
        log.debug("Message writers use line length {} and diff context {}",
                settings.getMaxLineLength(), settings.getDiffContextSize());
    }

    public TextMessageWriter newWriter() {
        return newWriter(new StringBuilderSink());
    }

    public TextMessageWriter newWriter(LineSink sink) {
        TextMessageWriter writer = new TextMessageWriter(sink);
        writer.setMaxLineLength(settings.getMaxLineLength());
        return writer;
    }

    /**
     * Full failure message for a result, preceded by an optional user message.
     */
    public String describeFailure(ComparisonResult result, String userMessage, Object... args) {
        TextMessageWriter writer = new TextMessageWriter(new StringBuilderSink(), userMessage, args);
        writer.setMaxLineLength(settings.getMaxLineLength());
        writer.displayDifferences(result);
        return writer.toString();
    }

    public String describeValues(Object expected, Object actual, Tolerance tolerance) {
        TextMessageWriter writer = newWriter();
        writer.displayDifferences(expected, actual, tolerance);
        return writer.toString();
    }

    public String describeStrings(String expected, String actual, boolean ignoreCase) {
        TextMessageWriter writer = newWriter();
        writer.displayStringDifferences(expected, actual, -1, ignoreCase, true);
        return writer.toString();
    }

    public TextBlockComparisonResult textBlockResult(String expected, String actual) {
        return new TextBlockComparisonResult(expected, actual, diffRenderer, settings.getDiffContextSize());
    }

    public DisplaySettings getSettings() {
        return settings;
    }
}
