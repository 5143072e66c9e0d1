package com.questrail.lockstep.observability;

import com.questrail.lockstep.model.Operation;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing one step whose observables matched on both sides.
 * {@code failed} is true when both sides rejected the call with the same error.
 */
public record StepComparedEvent(
    Instant timestamp,
    String run,
    int step,
    Operation operation,
    boolean failed,
    Duration elapsed
) {
}
