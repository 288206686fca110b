package com.questrail.menton.api;

import java.util.Objects;

/**
 * A character line does not resolve to any symbol table entry.
 *
 * <p>Carries the offending glyph run verbatim so a host can show it to the
 * user next to the line number.</p>
 */
public final class UnknownGlyphPatternException extends MentonException
{
    private final String glyphRun;

    public UnknownGlyphPatternException(int lineNumber, String glyphRun) {
        super(ErrorKind.UNKNOWN_GLYPH_PATTERN, lineNumber,
                "unknown glyph pattern '" + glyphRun + "'");
        this.glyphRun = Objects.requireNonNull(glyphRun, "glyphRun");
    }

    public String glyphRun() {
        return glyphRun;
    }
}
