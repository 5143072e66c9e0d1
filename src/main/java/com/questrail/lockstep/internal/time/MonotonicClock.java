package com.questrail.lockstep.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for measuring how long a step took.
 *
 * <p>Step durations MUST be measured with a monotonic source. Wall-clock time
 * is used only to stamp observability events.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
