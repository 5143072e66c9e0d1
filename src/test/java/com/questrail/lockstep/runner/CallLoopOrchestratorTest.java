package com.questrail.lockstep.runner;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.CollaboratorFault;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.api.Mutez;
import com.questrail.lockstep.compare.ObservableField;
import com.questrail.lockstep.internal.exec.CustomEntrypointDispatcher;
import com.questrail.lockstep.internal.exec.EntrypointCall;
import com.questrail.lockstep.internal.exec.FundingPolicy;
import com.questrail.lockstep.internal.exec.RecordingSystemClient;
import com.questrail.lockstep.internal.exec.SystemClient;
import com.questrail.lockstep.internal.exec.SystemExecutor;
import com.questrail.lockstep.internal.exec.UnsupportedCustomPolicy;
import com.questrail.lockstep.internal.normalize.ErrorNormalizer;
import com.questrail.lockstep.internal.normalize.NormalizationFault;
import com.questrail.lockstep.internal.normalize.RawFailure;
import com.questrail.lockstep.internal.state.ModelExecutor;
import com.questrail.lockstep.internal.state.ModelReducer;
import com.questrail.lockstep.internal.state.ModelState;
import com.questrail.lockstep.model.Freeze;
import com.questrail.lockstep.model.Operation;
import com.questrail.lockstep.model.ProposalKey;
import com.questrail.lockstep.model.Propose;
import com.questrail.lockstep.model.Sequence;
import com.questrail.lockstep.model.Unfreeze;
import com.questrail.lockstep.model.Vote;
import com.questrail.lockstep.model.VoteParam;
import com.questrail.lockstep.observability.FaultEvent;
import com.questrail.lockstep.observability.RecordingObservabilitySink;
import com.questrail.lockstep.observability.StepComparedEvent;
import com.questrail.lockstep.testkit.LookupRegistry;
import com.questrail.lockstep.testkit.ToyDaoModel;
import com.questrail.lockstep.testkit.ToyDaoSystem;
import com.questrail.lockstep.testkit.ToyEnvironment;
import com.questrail.lockstep.testkit.ToyStorage;
import com.questrail.lockstep.time.FixedWallClock;
import com.questrail.lockstep.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.questrail.lockstep.testkit.ToyEnvironment.ALICE;
import static com.questrail.lockstep.testkit.ToyEnvironment.DAO;
import static com.questrail.lockstep.testkit.ToyEnvironment.GOV;
import static com.questrail.lockstep.testkit.ToyEnvironment.VIEW;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CallLoopOrchestratorTest
 * -----------------------------------------------------------------------------
 * Drives hand-built toy runs step by step: lifecycle phases, early termination,
 * cancellation and faults.
 */
class CallLoopOrchestratorTest {

    private static final List<Address> TRACKED = List.of(GOV, VIEW);

    private static final List<Operation> FREEZE_PROPOSE_VOTE = List.of(
            Operation.call(ALICE, new Freeze(5)),
            Operation.call(ALICE, new Propose(ALICE, 1, "p1")),
            Operation.call(ALICE, new Vote(List.of(new VoteParam(new ProposalKey("p1"), true, 3, ALICE)))),
            Operation.call(ALICE, new Freeze(1)));

    private RecordingObservabilitySink sink;
    private RunCancellation cancellation;
    private ToyDaoSystem system;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        cancellation = new RunCancellation();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private CallLoopOrchestrator<ToyStorage> orchestrator(ToyDaoSystem.Flaw flaw, List<Operation> ops) {
        Sequence<ToyStorage> sequence =
                new Sequence<>(ToyEnvironment.ENVIRONMENT, ops, ToyEnvironment.initialStorage(), 0);
        system = new ToyDaoSystem(DAO, ToyEnvironment.ENVIRONMENT, ToyEnvironment.initialStorage(), 0, flaw);

        Map<Address, EntityState> entities = new LinkedHashMap<>();
        for (Address handle : ToyEnvironment.ENVIRONMENT.handles().values()) {
            entities.put(handle, EntityState.EMPTY);
        }
        ModelState<ToyStorage> initial =
                ModelState.of(DAO, ToyEnvironment.initialStorage(), Mutez.ZERO, entities, 0);

        return CallLoopOrchestrator.builder(
                        sequence,
                        new ModelExecutor<>(initial, new ToyDaoModel(), TRACKED),
                        new SystemExecutor<>(system, ErrorNormalizer.strict(),
                                CustomEntrypointDispatcher.forwarding(Set.of(LookupRegistry.NAME)),
                                UnsupportedCustomPolicy.NO_OP, FundingPolicy.defaults(), TRACKED))
                .withRun("toy#0")
                .withCancellation(cancellation)
                .withObservabilitySink(sink)
                .withWallClock(new FixedWallClock())
                .withMonotonicClock(new ManualMonotonicClock(1_000))
                .build();
    }

    @Test
    void faithfulRunCompletesThroughExpectedPhases() {
        CallLoopOrchestrator<ToyStorage> loop = orchestrator(ToyDaoSystem.Flaw.NONE, FREEZE_PROPOSE_VOTE.subList(0, 2));

        assertEquals(RunPhase.PENDING, loop.phase());
        RunResult result = loop.drain();

        assertEquals(new RunResult.Completed(2), result);
        assertEquals(List.of(RunPhase.STEPPING, RunPhase.PENDING, RunPhase.STEPPING, RunPhase.COMPLETED),
                sink.phases());
        assertEquals(2, sink.eventsOfType(StepComparedEvent.class).size());
        assertEquals(Duration.ofNanos(1_000), sink.eventsOfType(StepComparedEvent.class).get(0).elapsed());
    }

    @Test
    void stepProcessesExactlyOneOperation() {
        CallLoopOrchestrator<ToyStorage> loop = orchestrator(ToyDaoSystem.Flaw.NONE, FREEZE_PROPOSE_VOTE);

        assertTrue(loop.step());

        assertEquals(1, loop.stepsApplied());
        assertEquals(1, system.submissions());
        assertEquals(5L, loop.modelState().storage().frozenOf(ALICE));
        assertTrue(loop.result().isEmpty());
    }

    @Test
    void divergenceStopsWithExactlyKOperationsAppliedToEachSide() {
        CallLoopOrchestrator<ToyStorage> loop =
                orchestrator(ToyDaoSystem.Flaw.DOUBLE_COUNTED_VOTES, FREEZE_PROPOSE_VOTE);

        RunResult result = loop.drain();

        RunResult.Diverged diverged = assertInstanceOf(RunResult.Diverged.class, result);
        assertEquals(3, diverged.report().step());
        assertEquals(ObservableField.PRIMARY_OUTCOME, diverged.report().field());
        assertEquals(RunPhase.ABORTED, loop.phase());
        assertEquals(3, loop.stepsApplied());
        assertEquals(3, system.submissions());
        // The fourth operation (freeze 1) never reached the model either.
        assertEquals(5L, loop.modelState().storage().frozenOf(ALICE));
        assertEquals(3L, loop.modelState().storage().proposals().get("p1").upvotes());
    }

    @Test
    void steppingATerminalRunIsIllegal() {
        CallLoopOrchestrator<ToyStorage> loop = orchestrator(ToyDaoSystem.Flaw.NONE, List.of());

        assertEquals(new RunResult.Completed(0), loop.drain());
        assertThrows(IllegalStateException.class, loop::step);
        assertEquals(new RunResult.Completed(0), loop.drain());
    }

    @Test
    void cancellationBeforeFirstStepAppliesNothing() {
        CallLoopOrchestrator<ToyStorage> loop = orchestrator(ToyDaoSystem.Flaw.NONE, FREEZE_PROPOSE_VOTE);
        cancellation.cancel();

        assertEquals(new RunResult.Cancelled(0), loop.drain());
        assertEquals(0, system.submissions());
        assertEquals(RunPhase.CANCELLED, loop.phase());
    }

    @Test
    void cancellationIsObservedBetweenSteps() {
        CallLoopOrchestrator<ToyStorage> loop = orchestrator(ToyDaoSystem.Flaw.NONE, FREEZE_PROPOSE_VOTE);

        loop.step();
        cancellation.cancel();

        assertEquals(new RunResult.Cancelled(1), loop.drain());
        assertEquals(1, system.submissions());
    }

    @Test
    void interruptCountsAsCancellation() {
        CallLoopOrchestrator<ToyStorage> loop = orchestrator(ToyDaoSystem.Flaw.NONE, FREEZE_PROPOSE_VOTE);

        Thread.currentThread().interrupt();

        assertInstanceOf(RunResult.Cancelled.class, loop.drain());
        assertEquals(0, system.submissions());
    }

    @Test
    void clockOverflowInTheModelAbortsAsFault() {
        CallLoopOrchestrator<ToyStorage> loop = orchestrator(ToyDaoSystem.Flaw.NONE, List.of(
                Operation.call(ALICE, new Freeze(1)).withAdvance(1),
                Operation.call(ALICE, new Freeze(1)).withAdvance(Long.MAX_VALUE)));

        RunResult result = loop.drain();

        RunResult.Faulted faulted = assertInstanceOf(RunResult.Faulted.class, result);
        assertEquals(2, faulted.step());
        assertInstanceOf(CollaboratorFault.class, faulted.fault());
        assertInstanceOf(ArithmeticException.class, faulted.fault().getCause());
        assertEquals(RunPhase.ABORTED, loop.phase());
        assertEquals(1, loop.stepsApplied());
        assertEquals(1, system.submissions());
        assertThrows(IllegalStateException.class, loop::step);
    }

    @Test
    void unexpectedExceptionWhileComparingAbortsAsFault() {
        Sequence<Object> sequence = new Sequence<>(
                ToyEnvironment.ENVIRONMENT, List.of(Operation.call(ALICE, new Freeze(1))), new Incomparable(), 0);
        ModelState<Object> initial = ModelState.of(
                RecordingSystemClient.SELF, new Incomparable(), Mutez.ZERO, Map.of(), 0);
        CallLoopOrchestrator<Object> loop = CallLoopOrchestrator.builder(
                        sequence,
                        new ModelExecutor<>(initial, (state, op) -> ModelReducer.Result.success(state), List.of()),
                        new SystemExecutor<>(new IncomparableClient(), ErrorNormalizer.strict(),
                                CustomEntrypointDispatcher.none(), UnsupportedCustomPolicy.NO_OP,
                                FundingPolicy.none(), List.of()))
                .withObservabilitySink(sink)
                .build();

        RunResult.Faulted faulted = assertInstanceOf(RunResult.Faulted.class, loop.drain());

        assertEquals(1, faulted.step());
        assertInstanceOf(UnsupportedOperationException.class, faulted.fault().getCause());
        assertEquals(RunPhase.ABORTED, loop.phase());
        assertEquals(1, sink.eventsOfType(FaultEvent.class).size());
    }

    @Test
    void normalizationFaultAbortsWithoutReport() {
        CallLoopOrchestrator<ToyStorage> loop = orchestrator(ToyDaoSystem.Flaw.UNKNOWN_ERROR_TAG, List.of(
                Operation.call(ALICE, new Freeze(1)),
                Operation.call(ALICE, new Unfreeze(9)),
                Operation.call(ALICE, new Freeze(1))));

        RunResult result = loop.drain();

        RunResult.Faulted faulted = assertInstanceOf(RunResult.Faulted.class, result);
        assertEquals(2, faulted.step());
        assertInstanceOf(NormalizationFault.class, faulted.fault());
        assertEquals(RunPhase.ABORTED, loop.phase());
        assertEquals(1, loop.stepsApplied());
        assertEquals(2, system.submissions());
        assertEquals(1, sink.eventsOfType(FaultEvent.class).size());
    }

    /** Storage whose equality cannot be decided. */
    private static final class Incomparable {
        @Override
        public boolean equals(Object o) {
            throw new UnsupportedOperationException("not comparable");
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }

    private static final class IncomparableClient implements SystemClient<Object> {
        @Override public Address primaryAddress() { return RecordingSystemClient.SELF; }
        @Override public long currentLevel() { return 0; }
        @Override public void advanceLevel(long levels) {}
        @Override public void fund(Address address, Mutez amount) {}
        @Override public Optional<RawFailure> call(Address sender, EntrypointCall call) { return Optional.empty(); }
        @Override public Optional<RawFailure> transfer(Address sender, Mutez amount) { return Optional.empty(); }
        @Override public Object primaryStorage() { return new Incomparable(); }
        @Override public Mutez primaryBalance() { return Mutez.ZERO; }
        @Override public Optional<EntityState> entityState(Address address) { return Optional.empty(); }
    }
}
