package com.questrail.lockstep.runner;

/**
 * Cooperative cancellation flag for a run.
 *
 * <p>The orchestrator checks it between steps only: an operation that has
 * started on one side is always completed and compared. Interrupting the
 * thread that drives the run counts as cancellation too.</p>
 *
 * <p>A flag created with {@link #child()} also reads as cancelled once its
 * parent is; cancelling the child leaves the parent untouched.</p>
 */
public final class RunCancellation
{
    private final RunCancellation parent;
    private volatile boolean cancelled;

    public RunCancellation() {
        this(null);
    }

    private RunCancellation(RunCancellation parent) {
        this.parent = parent;
    }

    /**
     * Returns a flag that follows this one but can be cancelled on its own.
     */
    public RunCancellation child() {
        return new RunCancellation(this);
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }
}
