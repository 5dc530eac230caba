package com.example.assertdiff.config;

import com.example.assertdiff.infrastructure.TextMessageWriter;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Layout settings applied to every writer handed out by {@link MessageWriterFactory}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DisplaySettings {
    private int maxLineLength = TextMessageWriter.DEFAULT_LINE_LENGTH;
    private int diffContextSize = 3;
}
