package com.questrail.menton.exec;

import com.questrail.menton.api.ArithmeticOverflowException;
import com.questrail.menton.api.StepLimitExceededException;
import com.questrail.menton.api.UnknownGlyphPatternException;
import com.questrail.menton.config.MarkerSet;
import com.questrail.menton.config.MentonConfig;
import com.questrail.menton.config.MentonContext;
import com.questrail.menton.model.Program;
import com.questrail.menton.parse.BlockParser;
import com.questrail.menton.source.impl.DefaultSourcePreprocessor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DecoderExecutor}.
 *
 * Programs are written as source text and run through the preprocessor and
 * block parser first; only execution is under test here.
 */
public class DecoderExecutorTest
{
    private final DecoderExecutor executor = new DecoderExecutor();

    private static Program parse(String source)
    {
        return new BlockParser(MarkerSet.defaults())
                .parse(new DefaultSourcePreprocessor().preprocess(source));
    }

    private ExecutionResult run(String source)
    {
        return executor.execute(parse(source), MentonContext.standard());
    }

    private ExecutionResult run(String source, long stepLimit)
    {
        MentonContext context = MentonContext.standard()
                .withConfig(MentonConfig.builder().withStepLimit(stepLimit).build());
        return executor.execute(parse(source), context);
    }

    // ---------------------------------------------------------------------
    // Output modes
    // ---------------------------------------------------------------------

    /**
     * Verifies that each line of a character utterance appends exactly one code point, in order.
     */
    @Test
    void characterUtteranceAppendsOneCodePointPerLine()
    {
        ExecutionResult result = run("와타시는\n훠러훳훳훠훠\n허훠\n한다는 것이야\n");

        assertEquals("He", result.output());
        assertEquals(1, result.utterances());
        assertEquals(1, result.steps());
    }

    /**
     * Verifies that a numeric utterance prints register values and numerals in decimal and still
     * resolves the space shortcut through the symbol table.
     */
    @Test
    void numericUtterancePrintsRegistersNumeralsAndShortcuts()
    {
        ExecutionResult result = run(String.join("\n",
                "하요하요 허훠",
                "와타시는",
                "멘똔",
                "~",
                "훳훳",
                "이라는 것이야"));

        assertEquals("101 20", result.output());
    }

    /**
     * Verifies that a negative register value prints with a leading minus sign.
     */
    @Test
    void negativeValuesPrintWithSign()
    {
        assertEquals("-100", run("하요하요 뭐꼬허\n와타시는\n멘똔\n이라는 것이야").output());
    }

    /**
     * Verifies that a program without statements produces empty output and takes no steps.
     */
    @Test
    void emptyProgramProducesEmptyOutput()
    {
        ExecutionResult result = run("# nothing here\n");

        assertEquals("", result.output());
        assertEquals(0, result.steps());
    }

    // ---------------------------------------------------------------------
    // Registers and control flow
    // ---------------------------------------------------------------------

    /**
     * Verifies that multiply can take its factor from a register other than the current one.
     */
    @Test
    void multiplyReadsAnotherRegister()
    {
        String source = String.join("\n",
                "배털",
                "하요하요 6",
                "멘똔",
                "하요하요 7",
                "아주 좋고 배털",
                "와타시는",
                "멘똔",
                "이라는 것이야");

        assertEquals("42", run(source).output());
    }

    /**
     * Verifies that every register holds zero before it is first written.
     */
    @Test
    void registersStartAtZero()
    {
        assertEquals("0", run("민짜이\n와타시는\n민짜이\n이라는 것이야").output());
    }

    /**
     * Verifies that an if block runs its then branch when the condition holds and its else branch
     * otherwise.
     */
    @Test
    void ifTakesThenOrElseBranch()
    {
        String template = String.join("\n",
                "하요하요 %s",
                "건방진 5",
                "와타시는", "허훠", "한다는 것이야",
                "정신이 나갔어 정신이",
                "와타시는", "훠러훳훳훠훠", "한다는 것이야",
                "쉐끼마");

        assertEquals("e", run(String.format(template, "5")).output());
        assertEquals("H", run(String.format(template, "4")).output());
    }

    /**
     * Verifies that a while loop re-tests its condition after each pass and that every re-test is
     * counted as a step.
     */
    @Test
    void whileLoopCountsDown()
    {
        String source = String.join("\n",
                "하요하요 3",
                "좋다좋다 0 응나멘똔",
                "와타시는", "멘똔", "이라는 것이야",
                "매부 좋고",
                "쉐끼마");

        ExecutionResult result = run(source);

        assertEquals("321", result.output());
        assertEquals(11, result.steps());
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    /**
     * Verifies that a run stops with the configured limit once it would execute one step too many,
     * and completes when the limit is exactly large enough.
     */
    @Test
    void stepLimitStopsLongRuns()
    {
        String countdown = String.join("\n",
                "하요하요 3",
                "좋다좋다 0 응나멘똔",
                "와타시는", "멘똔", "이라는 것이야",
                "매부 좋고",
                "쉐끼마");

        StepLimitExceededException e = assertThrows(StepLimitExceededException.class,
                () -> run(countdown, 5));
        assertEquals(5, e.limit());

        assertEquals("321", run(countdown, 11).output());
    }

    /**
     * Verifies that a loop that never terminates is stopped by the step limit at the loop line.
     */
    @Test
    void infiniteLoopHitsStepLimit()
    {
        StepLimitExceededException e = assertThrows(StepLimitExceededException.class,
                () -> run("좋다좋다 0\n쉐끼마", 1000));
        assertEquals(1, e.lineNumber().orElseThrow());
    }

    /**
     * Verifies that arithmetic overflow is reported at the statement that overflowed, never wrapped.
     */
    @Test
    void overflowIsReportedAtTheStatement()
    {
        ArithmeticOverflowException e = assertThrows(ArithmeticOverflowException.class,
                () -> run("하요하요 9223372036854775807\n누이 좋고"));
        assertEquals(2, e.lineNumber().orElseThrow());
    }

    /**
     * Verifies that an unknown glyph run fails the program even inside a branch that would never run.
     */
    @Test
    void unknownGlyphInUntakenBranchStillFails()
    {
        String source = String.join("\n",
                "와타시는", "허훠", "한다는 것이야",
                "건방진 1",
                "와타시는", "뭐뭐", "한다는 것이야",
                "쉐끼마");

        UnknownGlyphPatternException e = assertThrows(UnknownGlyphPatternException.class,
                () -> run(source));
        assertEquals(6, e.lineNumber().orElseThrow());
        assertEquals("뭐뭐", e.glyphRun());
    }

    /**
     * Verifies that a numeric utterance line that is neither register, numeral nor table entry fails.
     */
    @Test
    void numericModeRejectsUnknownRuns()
    {
        assertThrows(UnknownGlyphPatternException.class,
                () -> run("와타시는\n뭐뭐\n이라는 것이야"));
    }

    // ---------------------------------------------------------------------
    // Deep nesting
    // ---------------------------------------------------------------------

    /**
     * Verifies that tens of thousands of nested if blocks execute without
     * exhausting the call stack, and that the innermost utterance still runs.
     */
    @Test
    void deeplyNestedIfBlocksExecute()
    {
        int depth = 50_000;
        String source = "건방진 0\n".repeat(depth)
                + "와타시는\n허훠\n한다는 것이야\n"
                + "쉐끼마\n".repeat(depth);

        ExecutionResult result = run(source);

        assertEquals("e", result.output());
        assertEquals(depth + 1, result.steps());
    }

    /**
     * Verifies that deeply nested while loops enter once each, run the
     * innermost body once, and unwind by re-testing every enclosing condition.
     */
    @Test
    void deeplyNestedWhileLoopsUnwind()
    {
        int depth = 20_000;
        String source = "좋다좋다 0\n".repeat(depth)
                + "와타시는\n허훠\n한다는 것이야\n"
                + "누이 좋고\n"
                + "쉐끼마\n".repeat(depth);

        ExecutionResult result = run(source);

        assertEquals("e", result.output());
        assertEquals(2L * depth + 2, result.steps());
    }
}
