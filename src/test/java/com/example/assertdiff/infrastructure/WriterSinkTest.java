package com.example.assertdiff.infrastructure;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WriterSinkTest {

    @Mock private Writer failingWriter;

    @Test
    void streamsLinesToWriter() {
        StringWriter out = new StringWriter();
        TextMessageWriter writer = new TextMessageWriter(new WriterSink(out, "\n"));

        writer.displayDifferences(1, 2);

        assertThat(out.toString()).isEqualTo("  Expected: 1\n  But was:  2\n");
    }

    @Test
    void flushIsPassedToWriter() throws IOException {
        new WriterSink(failingWriter).flush();

        verify(failingWriter).flush();
    }

    @Test
    void flushFailureIsUnchecked() throws IOException {
        IOException failure = new IOException("closed");
        doThrow(failure).when(failingWriter).flush();

        assertThatThrownBy(() -> new WriterSink(failingWriter).flush())
                .isInstanceOf(UncheckedIOException.class)
                .hasCause(failure);
    }

    @Test
    void writeFailureAbortsRendering() throws IOException {
        IOException failure = new IOException("disk full");
        doThrow(failure).when(failingWriter).write(anyString());
        TextMessageWriter writer = new TextMessageWriter(new WriterSink(failingWriter));

        assertThatThrownBy(() -> writer.displayDifferences(1, 2))
                .isInstanceOf(UncheckedIOException.class)
                .hasCause(failure);
    }
}
