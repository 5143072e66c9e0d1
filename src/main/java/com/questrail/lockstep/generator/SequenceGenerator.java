package com.questrail.lockstep.generator;

import com.questrail.lockstep.model.Sequence;

import java.util.Random;

/**
 * Domain-specific source of operation sequences.
 *
 * <p>Implementations must draw all randomness from the supplied {@link Random}.
 * Given the same random state and config they must return an equal sequence.</p>
 *
 * @param <S> primary storage type
 */
@FunctionalInterface
public interface SequenceGenerator<S>
{
    Sequence<S> draw(Random random, GeneratorConfig config);
}
