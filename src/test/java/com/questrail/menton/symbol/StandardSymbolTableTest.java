package com.questrail.menton.symbol;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

public class StandardSymbolTableTest
{
    private final SymbolTable table = StandardSymbolTable.get();

    /**
     * Verifies that the greeting fixture's glyph runs resolve to their expected codes.
     */
    @Test
    void containsHelloWorldGlyphRuns()
    {
        Map<String, Integer> fixture = Map.ofEntries(
                Map.entry("훠러훳훳훠훠", 72),
                Map.entry("허훠", 101),
                Map.entry("허훠러훠훠훠", 108),
                Map.entry("허훳훠", 111),
                Map.entry("훳훳훳훳훠훠훠훠", 44),
                Map.entry("훳훳훳훠훠", 32),
                Map.entry("훠러훳훳훳훠러훠훠", 87),
                Map.entry("허훳훠훠훠훠", 114),
                Map.entry("허", 100),
                Map.entry("훳훳훳훠훠훠", 33));

        fixture.forEach((run, code) ->
                assertEquals(OptionalInt.of(code), table.resolve(GlyphRun.of(run)), run));
    }

    /**
     * Verifies the space and newline shortcuts and the decimal spellings.
     */
    @Test
    void containsShortcutsAndDecimalSpellings()
    {
        assertEquals(OptionalInt.of(' '), table.resolve(GlyphRun.of(StandardSymbolTable.SPACE_SHORTCUT)));
        assertEquals(OptionalInt.of('\n'), table.resolve(GlyphRun.of(StandardSymbolTable.NEWLINE_SHORTCUT)));
        assertEquals(OptionalInt.of(0), table.resolve(GlyphRun.of("0")));
        assertEquals(OptionalInt.of(255), table.resolve(GlyphRun.of("255")));
    }

    /**
     * Verifies that the table ends at the last code and holds exactly the expected entries.
     */
    @Test
    void stopsAtTheLastCode()
    {
        assertTrue(table.resolve(GlyphRun.of("256")).isEmpty());
        assertTrue(table.resolve(GlyphRun.of(LaughNumerals.spell(256))).isEmpty());
        assertEquals(255 + 256 + 2, table.size());
    }

    /**
     * Verifies that the standard table is built once and shared.
     */
    @Test
    void isBuiltOnceAndShared()
    {
        assertSame(StandardSymbolTable.get(), StandardSymbolTable.get());
    }
}
