package com.questrail.menton.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default MentonObservabilitySink that emits logs via SLF4J.
 *
 * <p>Successful runs log at DEBUG. Failed runs log at WARN without a stack
 * trace: they are user input errors, surfaced to the caller in full.</p>
 */
public final class Slf4jMentonObservabilitySink implements MentonObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMentonObservabilitySink.class);

    @Override
    public void onRunCompleted(RunCompletedEvent event) {
        log.debug("Menton run completed: {} lines, {} utterances, {} steps, {} output chars",
            event.logicalLines(),
            event.utterances(),
            event.steps(),
            event.outputLength());
    }

    @Override
    public void onRunFailed(RunFailedEvent event) {
        log.warn("Menton run failed [{}]: {}", event.kind(), event.error().getMessage());
    }
}
