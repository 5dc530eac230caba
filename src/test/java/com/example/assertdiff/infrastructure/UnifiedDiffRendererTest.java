package com.example.assertdiff.infrastructure;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnifiedDiffRendererTest {

    private final UnifiedDiffRenderer renderer = new UnifiedDiffRenderer();

    @Test
    void renderProducesUnifiedHunk() {
        List<String> diff = renderer.render("text", "alpha\nbeta\ngamma", "alpha\nbeta2\ngamma", 1);

        assertEquals("--- text (expected)", diff.get(0));
        assertEquals("+++ text (actual)", diff.get(1));
        assertTrue(diff.contains("-beta"), "Diff should remove the expected line.");
        assertTrue(diff.contains("+beta2"), "Diff should add the actual line.");
        assertTrue(diff.contains(" alpha"), "Diff should keep context before the change.");
    }

    @Test
    void renderProducesFallbackWhenLinesMatch() {
        List<String> diff = renderer.render("text", "one\r\ntwo", "one\ntwo", 3);

        assertTrue(
                diff.contains("@@ -0,0 +0,0 @@"),
                "Diff should include synthetic hunk when no line differences exist.");
        assertTrue(
                diff.contains(" " + UnifiedDiffRenderer.NO_LINE_DIFFERENCES_MESSAGE),
                "Diff should include explanatory message when no line differences exist.");
    }

    @Test
    void trailingLineTerminatorIsNotALine() {
        List<String> diff = renderer.render("text", "a\n", "a", 3);

        assertTrue(diff.contains(" " + UnifiedDiffRenderer.NO_LINE_DIFFERENCES_MESSAGE));
    }

    @Test
    void trailingBlankLineIsDiffed() {
        List<String> diff = renderer.render("text", "a\n\n", "a", 0);

        assertTrue(diff.contains("-"), "Diff should remove the blank expected line.");
    }
}
