package com.questrail.lockstep.runner;

import com.questrail.lockstep.api.CollaboratorFault;
import com.questrail.lockstep.compare.DivergenceReport;
import com.questrail.lockstep.compare.ObservableComparator;
import com.questrail.lockstep.internal.exec.SystemExecutor;
import com.questrail.lockstep.internal.normalize.NormalizationFault;
import com.questrail.lockstep.internal.state.ModelExecutor;
import com.questrail.lockstep.internal.state.ModelState;
import com.questrail.lockstep.internal.time.MonotonicClock;
import com.questrail.lockstep.internal.time.SystemMonotonicClock;
import com.questrail.lockstep.internal.time.SystemWallClock;
import com.questrail.lockstep.internal.time.WallClock;
import com.questrail.lockstep.model.ObservableSet;
import com.questrail.lockstep.model.Operation;
import com.questrail.lockstep.model.Sequence;
import com.questrail.lockstep.observability.DivergenceEvent;
import com.questrail.lockstep.observability.FaultEvent;
import com.questrail.lockstep.observability.LockstepObservabilitySink;
import com.questrail.lockstep.observability.NullObservabilitySink;
import com.questrail.lockstep.observability.PhaseTransitionEvent;
import com.questrail.lockstep.observability.StepComparedEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * CallLoopOrchestrator
 * -----------------------------------------------------------------------------
 * Drives one generated {@link Sequence} through both implementations in
 * lockstep and stops at the first disagreement.
 *
 * <h2>Execution model</h2>
 * <pre>
 *   operation → model executor ─┐
 *             → system executor ┴→ comparator → next operation | abort
 * </pre>
 * <p>Single-threaded and strictly sequential: operation {@code k+1} is not
 * touched until operation {@code k} has been applied to both sides and
 * compared. Callers drive the loop explicitly via {@link #step()} or
 * {@link #drain()}.</p>
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>A divergence at step {@code k} aborts the run with exactly {@code k}
 *       operations applied to each side.</li>
 *   <li>A {@link NormalizationFault} or {@link CollaboratorFault} aborts the run;
 *       it is never reported as a divergence. Any other exception raised while
 *       stepping is wrapped in a {@link CollaboratorFault} and aborts the same way.</li>
 *   <li>Cancellation is checked before each step. A cancelled run produces no
 *       report.</li>
 * </ul>
 *
 * <p>After termination the model state at the point of divergence stays
 * available through {@link #modelState()}.</p>
 */
public final class CallLoopOrchestrator<S>
{
    private final String run;
    private final Sequence<S> sequence;
    private final ModelExecutor<S> model;
    private final SystemExecutor<S> system;
    private final ObservableComparator comparator;
    private final RunCancellation cancellation;
    private final LockstepObservabilitySink sink;
    private final WallClock wallClock;
    private final MonotonicClock monotonicClock;

    private RunPhase phase = RunPhase.PENDING;
    private int stepsApplied;
    private RunResult result;

    private CallLoopOrchestrator(Builder<S> b) {
        this.run = Objects.requireNonNull(b.run, "run");
        this.sequence = Objects.requireNonNull(b.sequence, "sequence");
        this.model = Objects.requireNonNull(b.model, "model");
        this.system = Objects.requireNonNull(b.system, "system");
        this.comparator = Objects.requireNonNull(b.comparator, "comparator");
        this.cancellation = Objects.requireNonNull(b.cancellation, "cancellation");
        this.sink = Objects.requireNonNull(b.sink, "sink");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.monotonicClock = Objects.requireNonNull(b.monotonicClock, "monotonicClock");
    }

    public static <S> Builder<S> builder(Sequence<S> sequence, ModelExecutor<S> model, SystemExecutor<S> system) {
        return new Builder<>(sequence, model, system);
    }

    /**
     * Processes exactly one operation, or moves to a terminal phase when there
     * is nothing left to do or the run was cancelled.
     *
     * @return {@code true} if the run can continue
     * @throws IllegalStateException if the orchestrator is already terminal
     */
    public boolean step() {
        if (phase.isTerminal()) {
            throw new IllegalStateException("Run " + run + " is already " + phase);
        }

        if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
            finish(RunPhase.CANCELLED, new RunResult.Cancelled(stepsApplied));
            return false;
        }
        if (stepsApplied == sequence.size()) {
            finish(RunPhase.COMPLETED, new RunResult.Completed(stepsApplied));
            return false;
        }

        int index = stepsApplied + 1;
        Operation operation = sequence.step(index);
        transition(RunPhase.STEPPING);

        long started = monotonicClock.nowNanos();
        Optional<DivergenceReport> divergence;
        ObservableSet<S> modelSide;
        try {
            modelSide = model.apply(operation);
            ObservableSet<S> systemSide = system.apply(operation).observables();
            divergence = comparator.compare(index, operation, modelSide, systemSide);
        } catch (NormalizationFault | CollaboratorFault e) {
            return abort(index, e);
        } catch (RuntimeException e) {
            return abort(index, new CollaboratorFault("Step " + index + " of run " + run + " failed", e));
        }
        stepsApplied = index;

        if (divergence.isPresent()) {
            DivergenceReport report = divergence.get();
            sink.onDivergence(new DivergenceEvent(wallClock.now(), run, report));
            finish(RunPhase.ABORTED, new RunResult.Diverged(report));
            return false;
        }

        Duration elapsed = Duration.ofNanos(monotonicClock.nowNanos() - started);
        sink.onStepCompared(new StepComparedEvent(
                wallClock.now(), run, index, operation, !modelSide.primary().isSuccess(), elapsed));

        if (stepsApplied == sequence.size()) {
            finish(RunPhase.COMPLETED, new RunResult.Completed(stepsApplied));
            return false;
        }
        transition(RunPhase.PENDING);
        return true;
    }

    /**
     * Runs until a terminal phase is reached.
     */
    public RunResult drain() {
        while (!phase.isTerminal() && step()) {
            // Intentionally empty.
        }
        return result;
    }

    private boolean abort(int index, RuntimeException fault) {
        sink.onFault(new FaultEvent(wallClock.now(), run, index, fault));
        finish(RunPhase.ABORTED, new RunResult.Faulted(index, fault));
        return false;
    }

    private void finish(RunPhase terminal, RunResult outcome) {
        this.result = outcome;
        transition(terminal);
    }

    private void transition(RunPhase next) {
        RunPhase previous = this.phase;
        this.phase = next;
        sink.onPhaseTransition(new PhaseTransitionEvent(wallClock.now(), run, previous, next, stepsApplied));
    }

    public RunPhase phase() {
        return phase;
    }

    /**
     * Number of operations applied to both sides so far.
     */
    public int stepsApplied() {
        return stepsApplied;
    }

    /**
     * Terminal result, empty while the run is still in progress.
     */
    public Optional<RunResult> result() {
        return Optional.ofNullable(result);
    }

    /**
     * Current model state; after an abort, the state at the point of divergence.
     */
    public ModelState<S> modelState() {
        return model.state();
    }

    public Sequence<S> sequence() {
        return sequence;
    }

    public String run() {
        return run;
    }

    public static final class Builder<S> {
        private final Sequence<S> sequence;
        private final ModelExecutor<S> model;
        private final SystemExecutor<S> system;
        private String run = "run";
        private ObservableComparator comparator = new ObservableComparator();
        private RunCancellation cancellation = new RunCancellation();
        private LockstepObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;

        private Builder(Sequence<S> sequence, ModelExecutor<S> model, SystemExecutor<S> system) {
            this.sequence = sequence;
            this.model = model;
            this.system = system;
        }

        public Builder<S> withRun(String run) {
            this.run = run;
            return this;
        }

        public Builder<S> withComparator(ObservableComparator comparator) {
            this.comparator = comparator;
            return this;
        }

        public Builder<S> withCancellation(RunCancellation cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public Builder<S> withObservabilitySink(LockstepObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder<S> withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder<S> withMonotonicClock(MonotonicClock monotonicClock) {
            this.monotonicClock = monotonicClock;
            return this;
        }

        public CallLoopOrchestrator<S> build() {
            return new CallLoopOrchestrator<>(this);
        }
    }
}
