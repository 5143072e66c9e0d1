package com.questrail.lockstep.observability;

/**
 * No-op implementation of LockstepObservabilitySink.
 */
public final class NullObservabilitySink implements LockstepObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {}

    @Override
    public void onStepCompared(StepComparedEvent event) {}

    @Override
    public void onDivergence(DivergenceEvent event) {}

    @Override
    public void onFault(FaultEvent event) {}
}
