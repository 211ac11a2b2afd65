package org.neuralchilli.planner.util;

import java.util.regex.Pattern;

/**
 * String helpers for turning block text into task display text.
 */
public final class StringFunctions {

    public static final String UNTITLED = "(untitled task)";

    // #tag or #[[tag with spaces]]
    private static final Pattern TAG_PATTERN = Pattern.compile("#\\[\\[[^\\]]*\\]\\]|#[^\\s#]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private StringFunctions() {
    }

    /**
     * Block text with inline tags removed and whitespace collapsed.
     * Example: "Write report #Task #work" -> "Write report"
     */
    public static String displayText(String blockText) {
        if (blockText == null || blockText.isBlank()) {
            return UNTITLED;
        }

        String stripped = TAG_PATTERN.matcher(blockText).replaceAll(" ");
        String collapsed = collapseWhitespace(stripped);

        return collapsed.isEmpty() ? UNTITLED : collapsed;
    }

    /**
     * Trim and replace every whitespace run with a single space
     */
    public static String collapseWhitespace(String input) {
        if (input == null) {
            return "";
        }
        return WHITESPACE.matcher(input.trim()).replaceAll(" ");
    }
}
