package com.questrail.menton.symbol;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * HashSymbolTable
 * -----------------------------------------------------------------------------
 * {@link SymbolTable} backed by an unmodifiable hash map.
 *
 * <p>This is the only table implementation the interpreter needs. Entries are
 * supplied through {@link Builder}, which rejects duplicates and invalid code
 * points so that a built table is always consistent.</p>
 */
public final class HashSymbolTable implements SymbolTable
{
    private final Map<GlyphRun, Integer> codeByRun;

    private HashSymbolTable(Map<GlyphRun, Integer> entries) {
        this.codeByRun = Collections.unmodifiableMap(new HashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public OptionalInt resolve(GlyphRun glyphRun) {
        Objects.requireNonNull(glyphRun, "glyphRun");
        Integer code = codeByRun.get(glyphRun);
        return (code == null) ? OptionalInt.empty() : OptionalInt.of(code);
    }

    @Override
    public int size() {
        return codeByRun.size();
    }

    @Override
    public Set<GlyphRun> glyphRuns() {
        return codeByRun.keySet();
    }

    @Override
    public String toString() {
        return "HashSymbolTable[size=" + codeByRun.size() + "]";
    }

    /**
     * Mutable, single-use builder. The built table does not observe later
     * changes to the builder.
     */
    public static final class Builder {
        private final Map<GlyphRun, Integer> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String glyphRun, int code) {
            return put(GlyphRun.of(glyphRun), code);
        }

        /**
         * Adds one entry.
         *
         * @throws IllegalArgumentException if the run already has an entry or
         *         the code is not a valid Unicode code point
         */
        public Builder put(GlyphRun glyphRun, int code) {
            Objects.requireNonNull(glyphRun, "glyphRun");
            if (!Character.isValidCodePoint(code)) {
                throw new IllegalArgumentException(
                        "Character code out of range for " + glyphRun + ": " + code);
            }
            Integer previous = entries.putIfAbsent(glyphRun, code);
            if (previous != null) {
                throw new IllegalArgumentException(
                        "Duplicate glyph run " + glyphRun + " (codes " + previous + " and " + code + ")");
            }
            return this;
        }

        /**
         * Copies every entry of an existing table.
         */
        public Builder putAll(SymbolTable table) {
            Objects.requireNonNull(table, "table");
            for (GlyphRun run : table.glyphRuns()) {
                put(run, table.resolve(run).orElseThrow());
            }
            return this;
        }

        public HashSymbolTable build() {
            return new HashSymbolTable(entries);
        }
    }
}
