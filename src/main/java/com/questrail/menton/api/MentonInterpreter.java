package com.questrail.menton.api;

/**
 * MentonInterpreter
 * -----------------------------------------------------------------------------
 * Entry point for decoding and executing Menton source text.
 *
 * <p>A run is a pure, synchronous transform:</p>
 * <pre>
 *   source text
 *        → preprocess   (logical lines)
 *        → parse        (utterances and statements)
 *        → execute      (output text)
 * </pre>
 *
 * <p>Implementations hold no state between runs. The same source always
 * yields the same output or the same error, and a single instance may be
 * shared by concurrent callers.</p>
 *
 * <p>The interpreter performs no I/O. How source text reaches it (an editor
 * widget, a file, a request body) is the host's concern.</p>
 */
public interface MentonInterpreter
{
    /**
     * Runs the given source and reports the outcome as a value.
     *
     * @param sourceText complete program text
     * @return {@link RunResult.Decoded} with the full output, or
     *         {@link RunResult.Failed} with the first error encountered
     */
    RunResult run(String sourceText);

    /**
     * Runs source supplied as UTF-8 bytes.
     *
     * <p>Malformed UTF-8 is reported as an {@link InputEncodingException}
     * failure; it is never replaced or skipped.</p>
     *
     * @param utf8Source complete program text encoded as UTF-8
     * @return the run outcome
     */
    RunResult run(byte[] utf8Source);

    /**
     * Runs the given source, returning the output directly.
     *
     * @param sourceText complete program text
     * @return the full output text
     * @throws MentonException if any stage of the run fails
     */
    String execute(String sourceText);
}
