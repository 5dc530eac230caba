package com.example.assertdiff.infrastructure;

import com.example.assertdiff.domain.ClippedPair;

/**
 * Locates the first difference between two strings and clips long strings
 * around it so that the difference stays on screen.
 */
public final class StringDiffRenderer {
    private static final String ELLIPSIS = ValueFormatter.ELLIPSIS;

    private StringDiffRenderer() {
    }

    /**
     * Index of the first character at which the strings differ, starting at {@code start}.
     * When one string is a prefix of the other the mismatch is where the shorter one ends.
     *
     * @return the mismatch index, or -1 if the strings are equal
     */
    public static int findMismatch(String expected, String actual, int start, boolean ignoreCase) {
        int length = Math.min(expected.length(), actual.length());
        for (int i = Math.max(0, start); i < length; i++) {
            char e = expected.charAt(i);
            char a = actual.charAt(i);
            if (e != a && !(ignoreCase && equalsIgnoreCase(e, a))) {
                return i;
            }
        }
        if (expected.length() != actual.length()) {
            return length;
        }
        return -1;
    }

    /**
     * Clip both strings to {@code maxDisplayLength} characters, using the same window for both
     * and keeping {@code mismatch} inside it. Positions shift after clipping, so callers must
     * locate the mismatch again in the clipped strings.
     */
    public static ClippedPair clip(String expected, String actual, int maxDisplayLength, int mismatch) {
        int maxStringLength = Math.max(expected.length(), actual.length());
        if (maxStringLength <= maxDisplayLength) {
            return new ClippedPair(expected, actual);
        }
        int clipLength = maxDisplayLength - ELLIPSIS.length();
        int clipStart = maxStringLength - clipLength;
        if (clipStart > mismatch) {
            clipStart = Math.max(0, mismatch - clipLength / 2);
        }
        return new ClippedPair(
                clipString(expected, maxDisplayLength, clipStart),
                clipString(actual, maxDisplayLength, clipStart));
    }

    /**
     * Clip a string to {@code maxLength} characters starting at {@code clipStart}, marking
     * removed content at either end with an ellipsis.
     */
    public static String clipString(String s, int maxLength, int clipStart) {
        int start = Math.min(Math.max(0, clipStart), s.length());
        int clipLength = maxLength;
        StringBuilder sb = new StringBuilder();
        if (start > 0) {
            clipLength -= ELLIPSIS.length();
            sb.append(ELLIPSIS);
        }
        if (s.length() - start > clipLength) {
            clipLength -= ELLIPSIS.length();
            sb.append(s, start, start + clipLength);
            sb.append(ELLIPSIS);
        } else {
            sb.append(s, start, s.length());
        }
        return sb.toString();
    }

    /**
     * Line with a caret under the mismatching character of a quoted value that follows a
     * prefix of {@code prefixLength} characters.
     */
    public static String caretLine(int prefixLength, int mismatch) {
        // two leading blanks, then dashes up to the opening quote and the mismatch offset
        return "  " + "-".repeat(prefixLength + mismatch - 2 + 1) + "^";
    }

    private static boolean equalsIgnoreCase(char e, char a) {
        return Character.toUpperCase(e) == Character.toUpperCase(a)
                || Character.toLowerCase(e) == Character.toLowerCase(a);
    }
}
