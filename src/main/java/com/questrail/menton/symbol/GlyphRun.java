package com.questrail.menton.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Strongly typed token content of one character line.
 *
 * <p>A glyph run is the exact text of a logical line, read as an ordered
 * sequence of syllables (one syllable per Unicode code point). Equality is
 * exact string equality: no case folding, no whitespace collapsing, no
 * Unicode normalisation. Whatever the preprocessor produced is what the
 * symbol table must match.</p>
 */
public final class GlyphRun
{
    private final String text;

    private GlyphRun(String text) {
        this.text = text;
    }

    /**
     * Creates a glyph run from a trimmed, non-empty line.
     *
     * @throws IllegalArgumentException if the text is empty or carries
     *         surrounding whitespace
     */
    public static GlyphRun of(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Glyph run must not be empty");
        }
        if (!text.equals(text.strip())) {
            throw new IllegalArgumentException("Glyph run must not carry surrounding whitespace: '" + text + "'");
        }
        return new GlyphRun(text);
    }

    /**
     * Returns the exact text of the run.
     */
    public String text() {
        return text;
    }

    /**
     * Returns the syllables of the run in order.
     */
    public List<String> syllables() {
        List<String> syllables = new ArrayList<>(text.length());
        text.codePoints().forEach(cp -> syllables.add(new String(Character.toChars(cp))));
        return Collections.unmodifiableList(syllables);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GlyphRun that)) return false;
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "GlyphRun[" + text + "]";
    }
}
