package com.questrail.lockstep.observability;

/**
 * Receives observability events from differential runs.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks observe; they never influence a run. A sink is called from the
 * thread driving the run, so a sink shared by parallel runs must be thread-safe.</p>
 */
public interface LockstepObservabilitySink {
    /**
     * Called when an orchestrator changes phase.
     * @param event the transition details
     */
    void onPhaseTransition(PhaseTransitionEvent event);

    /**
     * Called after a step whose observables matched.
     * @param event the step details
     */
    void onStepCompared(StepComparedEvent event);

    /**
     * Called once when a run aborts on a divergence.
     * @param event the divergence
     */
    void onDivergence(DivergenceEvent event);

    /**
     * Called once when a run aborts on a fatal fault.
     * @param event the fault
     */
    void onFault(FaultEvent event);
}
