package com.questrail.menton.symbol;

import java.util.OptionalInt;
import java.util.Set;

/**
 * SymbolTable
 * -----------------------------------------------------------------------------
 * Immutable mapping from a {@link GlyphRun} to a character code.
 *
 * <h2>Lookup semantics</h2>
 * <ul>
 *   <li>Exact match on the glyph run text; nothing is computed at lookup time</li>
 *   <li>O(1) amortised</li>
 *   <li>A missing entry is reported as {@link OptionalInt#empty()}; deciding
 *       whether that is an error belongs to the caller</li>
 * </ul>
 *
 * <p>A table is built once and never changes afterwards, so it may be shared
 * freely between runs and threads. To extend a table, build a new one with
 * {@link HashSymbolTable.Builder#putAll(SymbolTable)}.</p>
 */
public interface SymbolTable
{
    /**
     * Resolves a glyph run to its character code.
     *
     * @param glyphRun run to look up
     * @return the code point, or empty if the run has no entry
     */
    OptionalInt resolve(GlyphRun glyphRun);

    /**
     * Returns the number of entries.
     */
    int size();

    /**
     * Returns every glyph run that has an entry.
     */
    Set<GlyphRun> glyphRuns();

    /**
     * Returns true if the run has an entry.
     */
    default boolean contains(GlyphRun glyphRun) {
        return resolve(glyphRun).isPresent();
    }

    static HashSymbolTable.Builder builder() {
        return HashSymbolTable.builder();
    }
}
