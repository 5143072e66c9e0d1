package com.questrail.lockstep.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>This clock may jump (NTP, DST, manual changes). It never influences how a
 * run proceeds.</p>
 */
public interface WallClock
{
    Instant now();
}
