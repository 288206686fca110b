package com.questrail.menton.observability;

import com.questrail.menton.api.ErrorKind;
import com.questrail.menton.api.MentonException;

import java.time.Instant;

/**
 * Record describing a run that ended with an error.
 */
public record RunFailedEvent(
    Instant timestamp,
    MentonException error
) {
    public ErrorKind kind() {
        return error.kind();
    }
}
