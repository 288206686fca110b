package com.questrail.menton.observability;

import java.time.Instant;

/**
 * Record describing a run that produced output.
 */
public record RunCompletedEvent(
    Instant timestamp,
    int logicalLines,
    int utterances,
    long steps,
    int outputLength
) {
}
