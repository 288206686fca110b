package com.questrail.menton.api;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Base type of every failure surfaced by a Menton run.
 *
 * <p>Each pipeline stage throws a concrete subtype; nothing is retried or
 * recovered internally. {@link MentonInterpreter#run(String)} converts the
 * exception into a {@link RunResult.Failed}, while
 * {@link MentonInterpreter#execute(String)} lets it propagate.</p>
 *
 * <p>Line numbers are 1-based physical source lines. Failures that are not
 * tied to a line report {@link OptionalInt#empty()}.</p>
 */
public abstract class MentonException extends RuntimeException
{
    private final ErrorKind kind;
    private final int lineNumber;

    protected MentonException(ErrorKind kind, int lineNumber, String message) {
        this(kind, lineNumber, message, null);
    }

    protected MentonException(ErrorKind kind, int lineNumber, String message, Throwable cause) {
        super(render(lineNumber, message), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the classification of this failure.
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the 1-based source line the failure is attributed to, if any.
     */
    public OptionalInt lineNumber() {
        return lineNumber > 0 ? OptionalInt.of(lineNumber) : OptionalInt.empty();
    }

    private static String render(int lineNumber, String message) {
        return lineNumber > 0 ? "line " + lineNumber + ": " + message : message;
    }
}
