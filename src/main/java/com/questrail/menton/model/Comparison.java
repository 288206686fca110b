package com.questrail.menton.model;

import java.util.Optional;

/**
 * Comparison between the current register and a condition operand.
 */
public enum Comparison
{
    EQUAL(null),
    GREATER("응나멘똔"),
    LESS("응너도혁");

    // EQUAL has no token; it applies when no comparator is written.
    private final String glyph;

    Comparison(String glyph) {
        this.glyph = glyph;
    }

    public boolean test(long current, long operand) {
        return switch (this) {
            case EQUAL -> current == operand;
            case GREATER -> current > operand;
            case LESS -> current < operand;
        };
    }

    public static Optional<Comparison> forGlyph(String token) {
        for (Comparison comparison : values()) {
            if (comparison.glyph != null && comparison.glyph.equals(token)) {
                return Optional.of(comparison);
            }
        }
        return Optional.empty();
    }
}
