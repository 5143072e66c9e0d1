package com.questrail.lockstep.generator;

import com.questrail.lockstep.api.Environment;
import com.questrail.lockstep.model.Operation;
import com.questrail.lockstep.model.Sequence;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * ScriptedSequenceGenerator
 * -------------------------
 *
 * Returns exactly the operations provided, ignoring the seed.
 *
 * Useful for hand-written scenarios (propose then vote, vote on a missing
 * proposal, flush before the voting period ends) that must run as written.
 */
public final class ScriptedSequenceGenerator<S> implements SequenceGenerator<S>
{
    private final Environment environment;
    private final S initialStorage;
    private final List<Operation> operations;

    public ScriptedSequenceGenerator(Environment environment, S initialStorage, List<Operation> operations) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.initialStorage = Objects.requireNonNull(initialStorage, "initialStorage");
        this.operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
    }

    @Override
    public Sequence<S> draw(Random random, GeneratorConfig config) {
        return new Sequence<>(environment, operations, initialStorage, config.startLevel());
    }
}
