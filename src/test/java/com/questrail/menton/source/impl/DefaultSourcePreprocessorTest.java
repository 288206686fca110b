package com.questrail.menton.source.impl;

import com.questrail.menton.api.InputEncodingException;
import com.questrail.menton.source.LogicalLine;
import com.questrail.menton.source.SourceText;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultSourcePreprocessorTest
{
    private final DefaultSourcePreprocessor preprocessor = new DefaultSourcePreprocessor();

    /**
     * Verifies that comments and surrounding whitespace are removed and blank lines dropped,
     * while retained lines keep their physical line numbers.
     */
    @Test
    void stripsCommentsAndWhitespaceAndDropsBlankLines()
    {
        List<LogicalLine> lines = preprocessor.preprocess("  허훠  # e\n\n# only a comment\n허\r\n");

        assertEquals(List.of(
                new LogicalLine(1, "허훠"),
                new LogicalLine(4, "허")
        ), lines);
    }

    /**
     * Verifies that LF, CRLF and CR line breaks are all recognised.
     */
    @Test
    void acceptsEveryLineBreakConvention()
    {
        List<LogicalLine> lines = preprocessor.preprocess("a\rb\r\nc\nd");

        assertEquals(List.of(
                new LogicalLine(1, "a"),
                new LogicalLine(2, "b"),
                new LogicalLine(3, "c"),
                new LogicalLine(4, "d")
        ), lines);
    }

    /**
     * Verifies that the newline token splits a physical line and that a comment ends at it.
     */
    @Test
    void newlineTokenSplitsPhysicalLineAndEndsComment()
    {
        List<LogicalLine> lines = preprocessor.preprocess("와타시는으이?허훠 # e 으이?한다는 것이야");

        assertEquals(List.of(
                new LogicalLine(1, "와타시는"),
                new LogicalLine(1, "허훠"),
                new LogicalLine(1, "한다는 것이야")
        ), lines);
    }

    /**
     * Verifies that a line with a trailing comment matches the same line without it.
     */
    @Test
    void commentOnlyAffectsItsOwnLine()
    {
        List<LogicalLine> withComment = preprocessor.preprocess("허훠 # explanatory text");
        List<LogicalLine> without = preprocessor.preprocess("허훠");

        assertEquals(without, withComment);
    }

    /**
     * Verifies that a leading byte order mark is ignored.
     */
    @Test
    void byteOrderMarkIsIgnored()
    {
        assertEquals(List.of(new LogicalLine(1, "허")), preprocessor.preprocess("\uFEFF허"));
    }

    /**
     * Verifies that empty or whitespace-only source yields no lines.
     */
    @Test
    void emptySourceYieldsNoLines()
    {
        assertTrue(preprocessor.preprocess("").isEmpty());
        assertTrue(preprocessor.preprocess("\n  \n# nothing\n").isEmpty());
    }

    /**
     * Verifies that preprocessing the same text twice yields equal results.
     */
    @Test
    void sameInputYieldsSameOutput()
    {
        String source = "와타시는\n허훠 # e\n한다는 것이야\n";
        assertEquals(preprocessor.preprocess(source), preprocessor.preprocess(source));
    }

    /**
     * Verifies that an unpaired high surrogate is reported as an encoding error on its line.
     */
    @Test
    void unpairedSurrogateIsAnEncodingError()
    {
        InputEncodingException e = assertThrows(InputEncodingException.class,
                () -> preprocessor.preprocess("ok\nbad\uD800x"));

        assertEquals(2, e.lineNumber().orElseThrow());
    }

    /**
     * Verifies that a low surrogate with no high surrogate before it is an encoding error.
     */
    @Test
    void loneLowSurrogateIsAnEncodingError()
    {
        assertThrows(InputEncodingException.class, () -> preprocessor.preprocess("\uDC00"));
    }

    /**
     * Verifies that characters outside the basic plane pass through unchanged.
     */
    @Test
    void pairedSurrogatesAreWellFormed()
    {
        List<LogicalLine> lines = preprocessor.preprocess("😀");
        assertEquals("😀", lines.get(0).text());
    }

    /**
     * Verifies that malformed UTF-8 bytes are reported instead of replaced.
     */
    @Test
    void malformedUtf8IsRejectedNotReplaced()
    {
        byte[] invalid = new byte[] { (byte) 0xC3, (byte) 0x28 };

        assertThrows(InputEncodingException.class, () -> SourceText.decodeUtf8(invalid));
    }
}
