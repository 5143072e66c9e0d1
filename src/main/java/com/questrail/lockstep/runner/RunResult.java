package com.questrail.lockstep.runner;

import com.questrail.lockstep.compare.DivergenceReport;

import java.util.Objects;

/**
 * RunResult
 * -----------------------------------------------------------------------------
 * Terminal outcome of one differential run.
 *
 * <ul>
 *   <li>{@link Completed} - every operation matched on both sides</li>
 *   <li>{@link Diverged} - the implementations disagreed; carries the report</li>
 *   <li>{@link Faulted} - a normalization or collaborator fault aborted the run</li>
 *   <li>{@link Cancelled} - the run was stopped between steps; no report</li>
 * </ul>
 */
public sealed interface RunResult
        permits RunResult.Completed, RunResult.Diverged, RunResult.Faulted, RunResult.Cancelled
{
    /** Terminal phase the orchestrator ended in for this result. */
    RunPhase phase();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    record Completed(int stepsApplied) implements RunResult {
        @Override
        public RunPhase phase() {
            return RunPhase.COMPLETED;
        }
    }

    record Diverged(DivergenceReport report) implements RunResult {
        public Diverged {
            Objects.requireNonNull(report, "report");
        }

        @Override
        public RunPhase phase() {
            return RunPhase.ABORTED;
        }
    }

    /**
     * @param step  1-based step during which the fault happened, or 0 before the first step
     * @param fault the fault
     */
    record Faulted(int step, RuntimeException fault) implements RunResult {
        public Faulted {
            Objects.requireNonNull(fault, "fault");
        }

        @Override
        public RunPhase phase() {
            return RunPhase.ABORTED;
        }
    }

    record Cancelled(int stepsApplied) implements RunResult {
        @Override
        public RunPhase phase() {
            return RunPhase.CANCELLED;
        }
    }
}
