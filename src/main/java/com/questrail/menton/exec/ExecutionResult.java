package com.questrail.menton.exec;

import java.util.Objects;

/**
 * Output of a successful execution.
 *
 * @param output       complete decoded text
 * @param steps        number of statements executed, counting loop re-tests
 * @param utterances   number of utterances in the program, executed or not
 */
public record ExecutionResult(String output, long steps, int utterances)
{
    public ExecutionResult {
        Objects.requireNonNull(output, "output");
    }
}
