package com.questrail.lockstep.runner;

/**
 * Lifecycle of a {@link CallLoopOrchestrator}.
 *
 * <pre>
 *   PENDING → STEPPING → PENDING | COMPLETED | ABORTED
 *   PENDING → CANCELLED | COMPLETED
 * </pre>
 */
public enum RunPhase
{
    /** Waiting for the next step. */
    PENDING,

    /** Applying and comparing one operation. */
    STEPPING,

    /** Every operation was applied and matched. */
    COMPLETED,

    /** Stopped on a divergence or a fatal fault. */
    ABORTED,

    /** Stopped between steps on request. */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == CANCELLED;
    }
}
