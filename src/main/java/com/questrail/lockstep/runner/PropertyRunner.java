package com.questrail.lockstep.runner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * PropertyRunner
 * -----------------------------------------------------------------------------
 * Sweeps a range of seeds through a {@link DifferentialRun}.
 *
 * <h2>Execution</h2>
 * <ul>
 *   <li>{@code parallelism == 1}: seeds run one after another on the calling thread</li>
 *   <li>{@code parallelism > 1}: seeds run on a fixed pool; each run provisions
 *       its own system and model, nothing is shared between runs</li>
 * </ul>
 * Results are always reported in seed order.
 *
 * <h2>Stopping early</h2>
 * With {@code stopOnFailure}, the first seed that does not complete stops the
 * sweep. Sequential sweeps simply do not start later seeds; parallel sweeps
 * cancel runs still in flight or queued, which then report
 * {@link RunResult.Cancelled}. The {@link RunCancellation} passed by the caller
 * is only ever read, never set.
 */
public final class PropertyRunner<S>
{
    /**
     * Sweep configuration.
     */
    public record Settings(long firstSeed, int runs, int parallelism, boolean stopOnFailure, Duration shutdownTimeout) {
        public Settings {
            if (runs < 0) {
                throw new IllegalArgumentException("runs must be >= 0");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1");
            }
            Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must be non-negative");
            }
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private long firstSeed = 0;
            private int runs = 100;
            private int parallelism = 1;
            private boolean stopOnFailure = true;
            private Duration shutdownTimeout = Duration.ofSeconds(5);

            public Builder withFirstSeed(long firstSeed) {
                this.firstSeed = firstSeed;
                return this;
            }

            public Builder withRuns(int runs) {
                this.runs = runs;
                return this;
            }

            public Builder withParallelism(int parallelism) {
                this.parallelism = parallelism;
                return this;
            }

            public Builder withStopOnFailure(boolean stopOnFailure) {
                this.stopOnFailure = stopOnFailure;
                return this;
            }

            public Builder withShutdownTimeout(Duration shutdownTimeout) {
                this.shutdownTimeout = shutdownTimeout;
                return this;
            }

            public Settings build() {
                return new Settings(firstSeed, runs, parallelism, stopOnFailure, shutdownTimeout);
            }
        }
    }

    /** Result of one seed. */
    public record SeedResult(long seed, RunResult result) {
        public SeedResult {
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Results of a sweep, in seed order.
     */
    public record SweepReport(List<SeedResult> results) {
        public SweepReport {
            results = List.copyOf(results);
        }

        public boolean allCompleted() {
            for (SeedResult r : results) {
                if (!r.result().isCompleted()) {
                    return false;
                }
            }
            return true;
        }

        /**
         * First seed that diverged or faulted, ignoring cancellations caused by
         * stopping early.
         */
        public Optional<SeedResult> firstFailure() {
            for (SeedResult r : results) {
                if (r.result() instanceof RunResult.Diverged || r.result() instanceof RunResult.Faulted) {
                    return Optional.of(r);
                }
            }
            return Optional.empty();
        }

        /**
         * @throws AssertionError naming the first failing seed
         */
        public void assertAllCompleted() {
            Optional<SeedResult> failure = firstFailure();
            if (failure.isPresent()) {
                SeedResult f = failure.get();
                if (f.result() instanceof RunResult.Diverged d) {
                    throw new AssertionError("Seed " + f.seed() + " diverged:\n" + d.report().render());
                }
                RunResult.Faulted faulted = (RunResult.Faulted) f.result();
                throw new AssertionError("Seed " + f.seed() + " faulted at step " + faulted.step(), faulted.fault());
            }
            if (!allCompleted()) {
                throw new AssertionError("Sweep was cancelled before every seed completed");
            }
        }
    }

    private final DifferentialRun<S> run;
    private final Settings settings;

    public PropertyRunner(DifferentialRun<S> run, Settings settings) {
        this.run = Objects.requireNonNull(run, "run");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public SweepReport sweep() {
        return sweep(new RunCancellation());
    }

    public SweepReport sweep(RunCancellation cancellation) {
        Objects.requireNonNull(cancellation, "cancellation");
        return settings.parallelism() == 1 ? sequential(cancellation) : parallel(cancellation);
    }

    private SweepReport sequential(RunCancellation cancellation) {
        List<SeedResult> results = new ArrayList<>();
        for (int i = 0; i < settings.runs(); i++) {
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                break;
            }
            long seed = settings.firstSeed() + i;
            RunResult result = run.run(seed, cancellation);
            results.add(new SeedResult(seed, result));
            if (settings.stopOnFailure() && !result.isCompleted()) {
                break;
            }
        }
        return new SweepReport(results);
    }

    private SweepReport parallel(RunCancellation caller) {
        // Stopping early cancels this sweep's own flag, never the caller's.
        RunCancellation cancellation = caller.child();
        ExecutorService pool = Executors.newFixedThreadPool(settings.parallelism());
        List<Future<RunResult>> futures = new ArrayList<>(settings.runs());
        try {
            for (int i = 0; i < settings.runs(); i++) {
                long seed = settings.firstSeed() + i;
                futures.add(pool.submit(() -> {
                    RunResult result = run.run(seed, cancellation);
                    if (settings.stopOnFailure() && !result.isCompleted()) {
                        cancellation.cancel();
                    }
                    return result;
                }));
            }

            List<SeedResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                long seed = settings.firstSeed() + i;
                results.add(new SeedResult(seed, await(futures.get(i), cancellation)));
            }
            return new SweepReport(results);
        } finally {
            shutdown(pool);
        }
    }

    private static RunResult await(Future<RunResult> future, RunCancellation cancellation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            cancellation.cancel();
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new RunResult.Cancelled(0);
        } catch (CancellationException e) {
            return new RunResult.Cancelled(0);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Run failed", cause);
        }
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public Settings settings() {
        return settings;
    }
}
