package com.questrail.menton.symbol;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

public class HashSymbolTableTest
{
    /**
     * Verifies that lookup succeeds only for the exact glyph run that was registered.
     */
    @Test
    void resolvesExactMatchesOnly()
    {
        SymbolTable table = SymbolTable.builder()
                .put("허훠", 'e')
                .build();

        assertEquals(OptionalInt.of('e'), table.resolve(GlyphRun.of("허훠")));
        assertTrue(table.resolve(GlyphRun.of("허훠훠")).isEmpty());
        assertTrue(table.resolve(GlyphRun.of("허")).isEmpty());
        assertEquals(1, table.size());
    }

    /**
     * Verifies that registering the same glyph run twice is rejected.
     */
    @Test
    void duplicateGlyphRunIsRejected()
    {
        HashSymbolTable.Builder builder = SymbolTable.builder().put("허", 100);

        assertThrows(IllegalArgumentException.class, () -> builder.put("허", 101));
    }

    /**
     * Verifies that codes outside the Unicode code point range are rejected.
     */
    @Test
    void invalidCodePointIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> SymbolTable.builder().put("허", -1));
        assertThrows(IllegalArgumentException.class,
                () -> SymbolTable.builder().put("허", Character.MAX_CODE_POINT + 1));
    }

    /**
     * Verifies that an existing table can be copied into a builder and extended.
     */
    @Test
    void putAllExtendsAnExistingTable()
    {
        SymbolTable base = SymbolTable.builder().put("허", 100).build();
        SymbolTable extended = SymbolTable.builder()
                .putAll(base)
                .put("멍", 0xAC00)
                .build();

        assertEquals(2, extended.size());
        assertEquals(OptionalInt.of(100), extended.resolve(GlyphRun.of("허")));
        assertEquals(1, base.size());
    }

    /**
     * Verifies that a built table is unaffected by later changes to its builder.
     */
    @Test
    void builtTableDoesNotSeeLaterBuilderChanges()
    {
        HashSymbolTable.Builder builder = SymbolTable.builder().put("허", 100);
        SymbolTable table = builder.build();
        builder.put("헛", 1000);

        assertFalse(table.contains(GlyphRun.of("헛")));
        assertThrows(UnsupportedOperationException.class, () -> table.glyphRuns().clear());
    }

    /**
     * Verifies that glyph runs compare by exact text and expose one syllable per code point.
     */
    @Test
    void glyphRunComparesExactText()
    {
        assertEquals(GlyphRun.of("허훠"), GlyphRun.of("허훠"));
        assertNotEquals(GlyphRun.of("허훠"), GlyphRun.of("허 훠"));
        assertEquals(java.util.List.of("허", "훠"), GlyphRun.of("허훠").syllables());
    }

    /**
     * Verifies that glyph runs cannot be created from empty or untrimmed text.
     */
    @Test
    void glyphRunRejectsUntrimmedText()
    {
        assertThrows(IllegalArgumentException.class, () -> GlyphRun.of(""));
        assertThrows(IllegalArgumentException.class, () -> GlyphRun.of(" 허"));
    }
}
