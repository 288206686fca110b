package com.questrail.menton.model;

import com.questrail.menton.symbol.GlyphRun;

import java.util.Objects;

/**
 * A character line inside a word group.
 */
public record GlyphLine(int lineNumber, GlyphRun glyphRun)
{
    public GlyphLine {
        Objects.requireNonNull(glyphRun, "glyphRun");
    }
}
