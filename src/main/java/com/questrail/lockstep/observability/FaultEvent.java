package com.questrail.lockstep.observability;

import java.time.Instant;

/**
 * Record representing a fatal fault (normalization or collaborator) that
 * aborted a run. {@code step} is 0 when the fault happened before the first step.
 */
public record FaultEvent(
    Instant timestamp,
    String run,
    int step,
    RuntimeException fault
) {
}
