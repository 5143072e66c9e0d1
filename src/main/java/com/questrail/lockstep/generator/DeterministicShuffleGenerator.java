package com.questrail.lockstep.generator;

import com.questrail.lockstep.api.Environment;
import com.questrail.lockstep.model.Operation;
import com.questrail.lockstep.model.Sequence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * DeterministicShuffleGenerator
 * -----------------------------
 *
 * Takes a fixed list of operations and returns them in an order drawn from the
 * seed.
 *
 * Explores call orderings (vote before propose, flush between votes) without
 * introducing nondeterminism: the same seed always yields the same order.
 */
public final class DeterministicShuffleGenerator<S> implements SequenceGenerator<S>
{
    private final Environment environment;
    private final S initialStorage;
    private final List<Operation> operations;

    public DeterministicShuffleGenerator(Environment environment, S initialStorage, List<Operation> operations) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.initialStorage = Objects.requireNonNull(initialStorage, "initialStorage");
        this.operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
    }

    @Override
    public Sequence<S> draw(Random random, GeneratorConfig config) {
        List<Operation> copy = new ArrayList<>(operations);
        Collections.shuffle(copy, random);
        return new Sequence<>(environment, copy, initialStorage, config.startLevel());
    }
}
