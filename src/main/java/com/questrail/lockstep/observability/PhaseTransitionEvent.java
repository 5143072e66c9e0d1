package com.questrail.lockstep.observability;

import com.questrail.lockstep.runner.RunPhase;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of a call-loop orchestrator.
 */
public record PhaseTransitionEvent(
    Instant timestamp,
    String run,
    RunPhase oldPhase,
    RunPhase newPhase,
    int stepsApplied
) {
    public boolean isTerminal() {
        return newPhase.isTerminal();
    }
}
