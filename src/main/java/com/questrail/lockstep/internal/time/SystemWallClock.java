package com.questrail.lockstep.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p><strong>Do not use for timing.</strong> Step durations are measured with
 * {@link MonotonicClock}; this clock only stamps events for humans.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
