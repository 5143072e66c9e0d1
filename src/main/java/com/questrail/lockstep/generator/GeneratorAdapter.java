package com.questrail.lockstep.generator;

import com.questrail.lockstep.model.Sequence;

import java.util.Objects;
import java.util.Random;

/**
 * GeneratorAdapter
 * -----------------------------------------------------------------------------
 * Turns a seed into a {@link Sequence} by driving a {@link SequenceGenerator}.
 *
 * <p>The adapter owns the randomness: it builds a fresh {@link Random} from the
 * seed for every call, so the same seed and config always yield the same
 * sequence. It performs no business validation of the drawn operations.</p>
 *
 * <p>Anything the generator throws is rethrown as a {@link GeneratorFault}.</p>
 */
public final class GeneratorAdapter<S>
{
    private final SequenceGenerator<S> generator;

    public GeneratorAdapter(SequenceGenerator<S> generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    public Sequence<S> generate(long seed, GeneratorConfig config) {
        Objects.requireNonNull(config, "config");

        Sequence<S> sequence;
        try {
            sequence = generator.draw(new Random(seed), config);
        } catch (GeneratorFault e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GeneratorFault("Generator failed for seed " + seed, e);
        }

        if (sequence == null) {
            throw new GeneratorFault("Generator returned no sequence for seed " + seed);
        }
        if (sequence.size() > config.maxLength()) {
            throw new GeneratorFault("Generator returned " + sequence.size()
                    + " operations, more than maxLength " + config.maxLength());
        }
        return sequence;
    }
}
