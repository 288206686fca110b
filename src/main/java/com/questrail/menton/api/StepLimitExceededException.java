package com.questrail.menton.api;

/**
 * The run executed more statements than {@code MentonConfig.stepLimit()} allows.
 *
 * <p>The reported line is the statement that would have exceeded the limit.</p>
 */
public final class StepLimitExceededException extends MentonException
{
    private final long limit;

    public StepLimitExceededException(int lineNumber, long limit) {
        super(ErrorKind.STEP_LIMIT_EXCEEDED, lineNumber,
                "step limit of " + limit + " exceeded");
        this.limit = limit;
    }

    public long limit() {
        return limit;
    }
}
