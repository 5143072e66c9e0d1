package com.questrail.lockstep.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LockstepObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLockstepObservabilitySink implements LockstepObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLockstepObservabilitySink.class);

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {
        if (event.isTerminal()) {
            log.info("Run {}: {} -> {} after {} step(s)",
                event.run(), event.oldPhase(), event.newPhase(), event.stepsApplied());
        } else {
            log.debug("Run {}: {} -> {}", event.run(), event.oldPhase(), event.newPhase());
        }
    }

    @Override
    public void onStepCompared(StepComparedEvent event) {
        log.debug("Run {} step {} ({}{}) matched in {} ms",
            event.run(),
            event.step(),
            event.operation().entrypoint().entrypointName(),
            event.failed() ? ", failed on both sides" : "",
            event.elapsed().toMillis());
    }

    @Override
    public void onDivergence(DivergenceEvent event) {
        log.warn("Run {} diverged at step {} on {}\n{}",
            event.run(),
            event.report().step(),
            event.report().label(),
            event.report().render());
    }

    @Override
    public void onFault(FaultEvent event) {
        log.error("Run {} faulted at step {}: {}", event.run(), event.step(), event.fault().getMessage(), event.fault());
    }
}
