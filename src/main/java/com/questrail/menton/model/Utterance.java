package com.questrail.menton.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed output statement, bounded by a start marker and an end marker.
 *
 * <p>Word groups and their lines keep source order. At most one control
 * annotation is present, and only when the control marker sat directly before
 * the end marker.</p>
 *
 * @param lineNumber    line of the start marker
 * @param endLineNumber line of the end marker
 * @param mode          output mode selected by the end marker
 * @param wordGroups    non-empty word groups in order
 * @param annotations   control annotations in order
 */
public record Utterance(
        int lineNumber,
        int endLineNumber,
        OutputMode mode,
        List<WordGroup> wordGroups,
        List<ControlAnnotation> annotations
) implements Statement
{
    public Utterance {
        Objects.requireNonNull(mode, "mode");
        wordGroups = List.copyOf(Objects.requireNonNull(wordGroups, "wordGroups"));
        annotations = List.copyOf(Objects.requireNonNull(annotations, "annotations"));
        if (endLineNumber < lineNumber) {
            throw new IllegalArgumentException("Utterance ends before it starts");
        }
    }

    /**
     * Returns every character line of the utterance in source order.
     */
    public List<GlyphLine> glyphLines() {
        List<GlyphLine> all = new ArrayList<>();
        for (WordGroup group : wordGroups) {
            all.addAll(group.lines());
        }
        return Collections.unmodifiableList(all);
    }
}
