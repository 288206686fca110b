package com.questrail.menton.observability;

/**
 * Receives one event per interpreter run.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called synchronously on the calling thread and may be invoked
 * by concurrent runs, so implementations must be thread-safe.</p>
 */
public interface MentonObservabilitySink {
    /**
     * Called after a run produced its complete output.
     * @param event run statistics
     */
    void onRunCompleted(RunCompletedEvent event);

    /**
     * Called after a run failed, before the failure reaches the caller.
     * @param event the failure
     */
    void onRunFailed(RunFailedEvent event);
}
