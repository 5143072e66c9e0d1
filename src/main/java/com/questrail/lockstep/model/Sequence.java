package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Environment;

import java.util.List;
import java.util.Objects;

/**
 * Sequence
 * -----------------------------------------------------------------------------
 * Everything a generator draws for one run: the ordered operations, the
 * environment they were built against, the initial primary storage and the
 * starting level offset.
 *
 * <p>Created once per run by the generator adapter; read-only thereafter.</p>
 *
 * @param <S> primary storage type
 */
public record Sequence<S>(Environment environment,
                          List<Operation> operations,
                          S initialStorage,
                          long startLevel)
{
    public Sequence {
        Objects.requireNonNull(environment, "environment");
        operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
        Objects.requireNonNull(initialStorage, "initialStorage");
        if (startLevel < 0) {
            throw new IllegalArgumentException("startLevel must be >= 0");
        }
    }

    public int size() {
        return operations.size();
    }

    /**
     * Returns the operation at 1-based step {@code step}.
     */
    public Operation step(int step) {
        if (step < 1 || step > operations.size()) {
            throw new IndexOutOfBoundsException("step " + step + " outside 1.." + operations.size());
        }
        return operations.get(step - 1);
    }
}
