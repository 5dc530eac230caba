package com.example.assertdiff.infrastructure;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class LoggingSinkTest {

    @Mock private Logger logger;

    @Test
    void eachCompletedLineIsOneLogEvent() {
        TextMessageWriter writer = new TextMessageWriter(new LoggingSink(logger, Level.WARN));

        writer.displayDifferences(4, 4L);

        InOrder order = inOrder(logger);
        order.verify(logger).log(Level.WARN, "  Expected: 4 (Integer)");
        order.verify(logger).log(Level.WARN, "  But was:  4 (Long)");
        verifyNoMoreInteractions(logger);
    }
}
