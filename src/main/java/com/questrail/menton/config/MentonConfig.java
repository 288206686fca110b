package com.questrail.menton.config;

import com.questrail.menton.internal.time.SystemWallClock;
import com.questrail.menton.internal.time.WallClock;

import java.util.Objects;

/**
 * Aggregated configuration for Menton runs.
 *
 * @param markers    delimiter vocabulary used by the block parser
 * @param stepLimit  maximum number of statements a single run may execute
 * @param wallClock  timestamp source for observability events
 */
public record MentonConfig(
    MarkerSet markers,
    long stepLimit,
    WallClock wallClock
) {
    public static final long UNLIMITED_STEPS = Long.MAX_VALUE;

    private static final MentonConfig DEFAULTS = builder().build();

    public MentonConfig {
        Objects.requireNonNull(markers, "markers");
        Objects.requireNonNull(wallClock, "wallClock");
        if (stepLimit <= 0) {
            throw new IllegalArgumentException("stepLimit must be positive (was " + stepLimit + ")");
        }
    }

    public static MentonConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MarkerSet markers = MarkerSet.defaults();
        private long stepLimit = UNLIMITED_STEPS;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withMarkers(MarkerSet markers) {
            this.markers = markers;
            return this;
        }

        public Builder withStepLimit(long stepLimit) {
            this.stepLimit = stepLimit;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public MentonConfig build() {
            return new MentonConfig(markers, stepLimit, wallClock);
        }
    }
}
