package com.questrail.menton.observability;

/**
 * No-op implementation of MentonObservabilitySink.
 */
public final class NullObservabilitySink implements MentonObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRunCompleted(RunCompletedEvent event) {}

    @Override
    public void onRunFailed(RunFailedEvent event) {}
}
