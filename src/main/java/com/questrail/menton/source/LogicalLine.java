package com.questrail.menton.source;

import java.util.Objects;

/**
 * One line of source after comment stripping and trimming.
 *
 * @param lineNumber 1-based physical line the text came from
 * @param text       non-empty, trimmed line content
 */
public record LogicalLine(int lineNumber, String text)
{
    public LogicalLine {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1 (was " + lineNumber + ")");
        }
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        if (!text.equals(text.strip())) {
            throw new IllegalArgumentException("text must be trimmed: '" + text + "'");
        }
    }
}
