package com.questrail.lockstep.runner;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.CollaboratorFault;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.compare.ObservableComparator;
import com.questrail.lockstep.config.RunProfile;
import com.questrail.lockstep.generator.GeneratorAdapter;
import com.questrail.lockstep.generator.GeneratorConfig;
import com.questrail.lockstep.generator.SequenceGenerator;
import com.questrail.lockstep.internal.exec.SystemClient;
import com.questrail.lockstep.internal.exec.SystemExecutor;
import com.questrail.lockstep.internal.normalize.NormalizationFault;
import com.questrail.lockstep.internal.state.ModelExecutor;
import com.questrail.lockstep.internal.state.ModelReducer;
import com.questrail.lockstep.internal.state.ModelState;
import com.questrail.lockstep.internal.time.MonotonicClock;
import com.questrail.lockstep.internal.time.SystemMonotonicClock;
import com.questrail.lockstep.internal.time.SystemWallClock;
import com.questrail.lockstep.internal.time.WallClock;
import com.questrail.lockstep.model.Sequence;
import com.questrail.lockstep.observability.FaultEvent;
import com.questrail.lockstep.observability.LockstepObservabilitySink;
import com.questrail.lockstep.observability.NullObservabilitySink;
import com.questrail.lockstep.replay.ReplayBundle;
import com.questrail.lockstep.replay.ReplayBundleWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DifferentialRun
 * =============================================================================
 * Composition root for differential runs of one contract variant.
 *
 * <h2>Per seed</h2>
 * <ol>
 *   <li>generate the sequence from the seed</li>
 *   <li>provision a fresh system under test</li>
 *   <li>advance the system by the sequence's start level; the model starts at
 *       the level the system reports afterwards</li>
 *   <li>fund the primary contract with the profile's initial balance; the model
 *       starts with the same balance</li>
 *   <li>start the model with every environment entity empty</li>
 *   <li>run the call loop; on divergence, write a replay bundle if a directory
 *       was configured</li>
 * </ol>
 *
 * <p>A {@code DifferentialRun} holds configuration only. Every call to
 * {@link #run(long)} builds its own system client, model state and executors, so
 * one instance can serve many seeds in parallel as long as the generator,
 * reducer, provisioner and sink are thread-safe.</p>
 */
public final class DifferentialRun<S>
{
    private static final Logger log = LoggerFactory.getLogger(DifferentialRun.class);

    private final GeneratorAdapter<S> generator;
    private final ModelReducer<S> reducer;
    private final SystemProvisioner<S> provisioner;
    private final RunProfile profile;
    private final GeneratorConfig generatorConfig;
    private final LockstepObservabilitySink sink;
    private final ReplayBundleWriter replayWriter;
    private final WallClock wallClock;
    private final MonotonicClock monotonicClock;

    private DifferentialRun(Builder<S> b) {
        this.generator = new GeneratorAdapter<>(b.generator);
        this.reducer = b.reducer;
        this.provisioner = b.provisioner;
        this.profile = b.profile;
        this.generatorConfig = b.generatorConfig;
        this.sink = b.sink;
        this.replayWriter = b.replayDirectory == null ? null : new ReplayBundleWriter(b.replayDirectory);
        this.wallClock = b.wallClock;
        this.monotonicClock = b.monotonicClock;
    }

    /**
     * Runs one seed to a terminal result. Faults raised while composing the run
     * are reported as {@link RunResult.Faulted} at step 0.
     */
    public RunResult run(long seed) {
        return run(seed, new RunCancellation());
    }

    /**
     * Runs one seed unless {@code cancellation} is already set, in which case
     * nothing is generated or provisioned and the result is
     * {@code Cancelled(0)}.
     */
    public RunResult run(long seed, RunCancellation cancellation) {
        Objects.requireNonNull(cancellation, "cancellation");
        if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
            return new RunResult.Cancelled(0);
        }

        CallLoopOrchestrator<S> orchestrator;
        try {
            orchestrator = prepare(seed, cancellation);
        } catch (CollaboratorFault | NormalizationFault e) {
            return prepareFailed(seed, e);
        } catch (RuntimeException e) {
            return prepareFailed(seed, new CollaboratorFault("Could not compose run " + label(seed), e));
        }

        RunResult result = orchestrator.drain();
        if (result instanceof RunResult.Diverged diverged && replayWriter != null) {
            writeReplay(seed, orchestrator.sequence(), diverged);
        }
        return result;
    }

    /**
     * Runs one seed and fails like a JUnit assertion unless both sides agreed on
     * every step.
     *
     * @throws AssertionError carrying the rendered report on divergence, or when
     *                        the run was cancelled
     * @throws CollaboratorFault  if a collaborator broke the run
     * @throws NormalizationFault if a system failure could not be normalized
     */
    public RunResult.Completed assertEquivalent(long seed) {
        RunResult result = run(seed);
        if (result instanceof RunResult.Completed completed) {
            return completed;
        }
        if (result instanceof RunResult.Diverged diverged) {
            throw new AssertionError(diverged.report().render());
        }
        if (result instanceof RunResult.Faulted faulted) {
            throw faulted.fault();
        }
        throw new AssertionError("Run " + label(seed) + " was cancelled after "
                + ((RunResult.Cancelled) result).stepsApplied() + " step(s)");
    }

    /**
     * Composes a run for {@code seed} without starting it, for callers that
     * want to drive the loop step by step.
     *
     * @throws CollaboratorFault if generation, provisioning or level/balance
     *                           synchronisation fails
     */
    public CallLoopOrchestrator<S> prepare(long seed, RunCancellation cancellation) {
        Objects.requireNonNull(cancellation, "cancellation");

        // 1. Generate
        Sequence<S> sequence = generator.generate(seed, generatorConfig);

        // 2. Provision
        SystemClient<S> client;
        try {
            client = provisioner.provision(sequence, profile);
        } catch (CollaboratorFault e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFault("Provisioning failed for " + label(seed), e);
        }
        if (client == null) {
            throw new CollaboratorFault("Provisioner returned no client for " + label(seed));
        }

        // 3-4. Sync level and seed the primary balance
        Address self;
        long level;
        try {
            if (sequence.startLevel() > 0) {
                client.advanceLevel(sequence.startLevel());
            }
            level = client.currentLevel();
            self = client.primaryAddress();
            if (!profile.initialBalance().isZero()) {
                client.fund(self, profile.initialBalance());
            }
        } catch (RuntimeException e) {
            throw new CollaboratorFault("Could not synchronise the system for " + label(seed), e);
        }

        // 5. Model starts with every environment entity empty
        List<Address> tracked = profile.tracked().resolve(sequence.environment());
        Map<Address, EntityState> entities = new LinkedHashMap<>();
        for (Address handle : tracked) {
            entities.put(handle, EntityState.EMPTY);
        }
        for (Address handle : sequence.environment().handles().values()) {
            entities.putIfAbsent(handle, EntityState.EMPTY);
        }
        ModelState<S> initial = ModelState.of(
                self, sequence.initialStorage(), profile.initialBalance(), entities, level);

        // 6. Executors and loop
        ModelExecutor<S> model = new ModelExecutor<>(initial, reducer, tracked);
        SystemExecutor<S> system = new SystemExecutor<>(
                client,
                profile.normalizer(),
                profile.dispatcher(),
                profile.unsupportedPolicy(),
                profile.funding(),
                tracked);

        return CallLoopOrchestrator.builder(sequence, model, system)
                .withRun(label(seed))
                .withComparator(new ObservableComparator())
                .withCancellation(cancellation)
                .withObservabilitySink(sink)
                .withWallClock(wallClock)
                .withMonotonicClock(monotonicClock)
                .build();
    }

    private RunResult prepareFailed(long seed, RuntimeException fault) {
        sink.onFault(new FaultEvent(wallClock.now(), label(seed), 0, fault));
        return new RunResult.Faulted(0, fault);
    }

    private void writeReplay(long seed, Sequence<S> sequence, RunResult.Diverged diverged) {
        try {
            Path written = replayWriter.write(ReplayBundle.of(profile.name(), seed, sequence, diverged.report()));
            log.info("Replay bundle for {} written to {}", label(seed), written);
        } catch (IOException e) {
            log.warn("Could not write replay bundle for {} into {}", label(seed), replayWriter.directory(), e);
        }
    }

    private String label(long seed) {
        return profile.name() + "#" + seed;
    }

    public RunProfile profile() {
        return profile;
    }

    public Optional<Path> replayDirectory() {
        return replayWriter == null ? Optional.empty() : Optional.of(replayWriter.directory());
    }

    public static <S> Builder<S> builder() {
        return new Builder<>();
    }

    public static final class Builder<S> {
        private SequenceGenerator<S> generator;
        private ModelReducer<S> reducer;
        private SystemProvisioner<S> provisioner;
        private RunProfile profile = RunProfile.base();
        private GeneratorConfig generatorConfig = GeneratorConfig.defaults();
        private LockstepObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private Path replayDirectory;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;

        private Builder() {}

        public Builder<S> withGenerator(SequenceGenerator<S> generator) {
            this.generator = generator;
            return this;
        }

        public Builder<S> withReducer(ModelReducer<S> reducer) {
            this.reducer = reducer;
            return this;
        }

        public Builder<S> withProvisioner(SystemProvisioner<S> provisioner) {
            this.provisioner = provisioner;
            return this;
        }

        public Builder<S> withProfile(RunProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder<S> withGeneratorConfig(GeneratorConfig generatorConfig) {
            this.generatorConfig = generatorConfig;
            return this;
        }

        public Builder<S> withObservabilitySink(LockstepObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Enables replay bundles for diverged runs.
         */
        public Builder<S> withReplayDirectory(Path replayDirectory) {
            this.replayDirectory = replayDirectory;
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

        public DifferentialRun<S> build() {
            Objects.requireNonNull(generator, "generator");
            Objects.requireNonNull(reducer, "reducer");
            Objects.requireNonNull(provisioner, "provisioner");
            Objects.requireNonNull(profile, "profile");
            Objects.requireNonNull(generatorConfig, "generatorConfig");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            return new DifferentialRun<>(this);
        }
    }
}
