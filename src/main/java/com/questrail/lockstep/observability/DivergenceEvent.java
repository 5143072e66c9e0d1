package com.questrail.lockstep.observability;

import com.questrail.lockstep.compare.DivergenceReport;

import java.time.Instant;

/**
 * Record representing the divergence that aborted a run.
 */
public record DivergenceEvent(
    Instant timestamp,
    String run,
    DivergenceReport report
) {
}
