package com.questrail.menton.symbol;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

public class NumeralsTest
{
    /**
     * Verifies that ASCII decimal digits with an optional sign are read as numerals.
     */
    @Test
    void decimalDigitsWithOptionalSign()
    {
        assertEquals(OptionalLong.of(42), Numerals.parse("42"));
        assertEquals(OptionalLong.of(-7), Numerals.parse("-7"));
        assertEquals(OptionalLong.of(3), Numerals.parse("+3"));
    }

    /**
     * Verifies that text that is not decimal is read as a laugh number.
     */
    @Test
    void fallsBackToLaughNumbers()
    {
        assertEquals(OptionalLong.of(100), Numerals.parse("허"));
    }

    /**
     * Verifies that text in neither form, or out of range, is not a numeral.
     */
    @Test
    void rejectsEverythingElse()
    {
        assertTrue(Numerals.parse("abc").isEmpty());
        assertTrue(Numerals.parse("1.5").isEmpty());
        assertTrue(Numerals.parse("99999999999999999999").isEmpty());
    }
}
