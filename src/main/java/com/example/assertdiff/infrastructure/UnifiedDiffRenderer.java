package com.example.assertdiff.infrastructure;

import com.example.assertdiff.application.DiffRenderer;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Line diff of two text blocks in unified format, headed by the expected and actual sides.
 */
@Component
public class UnifiedDiffRenderer implements DiffRenderer {
    private static final Logger log = LogManager.getLogger(UnifiedDiffRenderer.class);

    static final String NO_LINE_DIFFERENCES_MESSAGE = "No line-level differences available.";

    @Override
    public List<String> render(String label, String expected, String actual, int contextSize) {
        String expectedSide = label + " (expected)";
        String actualSide = label + " (actual)";
        List<String> expectedLines = DiffRenderer.lines(expected);
        Patch<String> patch = DiffUtils.diff(expectedLines, DiffRenderer.lines(actual));
        if (patch.getDeltas().isEmpty()) {
            log.debug("Texts for {} differ only in line terminators", label);
            return terminatorOnlyDiff(expectedSide, actualSide);
        }
        return UnifiedDiffUtils.generateUnifiedDiff(
                expectedSide, actualSide, expectedLines, patch, Math.max(0, contextSize));
    }

    // lines compare equal, so the texts differ only in their line terminators
    private static List<String> terminatorOnlyDiff(String expectedSide, String actualSide) {
        return List.of(
                "--- " + expectedSide,
                "+++ " + actualSide,
                "@@ -0,0 +0,0 @@",
                " " + NO_LINE_DIFFERENCES_MESSAGE);
    }
}
