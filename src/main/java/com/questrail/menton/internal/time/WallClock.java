package com.questrail.menton.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of wall-clock timestamps for observability events.
 *
 * <p>Run semantics never depend on this clock; it only stamps the events
 * handed to an observability sink. Tests substitute a fixed clock.</p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
