package com.questrail.menton.internal.time;

import java.time.Instant;

/**
 * {@link WallClock} backed by {@link Instant#now()}. Thread-safe.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
