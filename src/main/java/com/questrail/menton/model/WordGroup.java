package com.questrail.menton.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered character lines between two word boundaries of an utterance.
 *
 * <p>Empty groups are never created; a separator that closes nothing leaves
 * no trace in the parsed utterance.</p>
 */
public record WordGroup(List<GlyphLine> lines)
{
    public WordGroup {
        Objects.requireNonNull(lines, "lines");
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("WordGroup must contain at least one line");
        }
        lines = List.copyOf(lines);
    }
}
