package com.example.assertdiff.infrastructure;

import com.example.assertdiff.application.LineSink;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Sends each completed line to a Log4j logger as its own event.
 */
public class LoggingSink implements LineSink {
    private final Logger logger;
    private final Level level;
    private final StringBuilder pending = new StringBuilder();

    public LoggingSink(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNull(level, "level");
    }

    @Override
    public void write(String text) {
        pending.append(text);
    }

    @Override
    public void writeLine(String text) {
        pending.append(text);
        String line = pending.toString();
        pending.setLength(0);
        logger.log(level, line);
    }
}
