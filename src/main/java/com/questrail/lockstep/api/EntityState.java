package com.questrail.lockstep.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * EntityState
 * -----------------------------------------------------------------------------
 * Observable sub-state of one auxiliary entity: its storage and its balance.
 *
 * <p>Auxiliary entities in a run are recorders: a dummy token contract stores the
 * transfer batches it received, a consumer contract stores the values it was
 * called back with. Storage is therefore an ordered list of recorded values,
 * compared element-wise with {@link Object#equals(Object)}. Recorded values must
 * be immutable value types (records, strings, numbers).</p>
 */
public record EntityState(List<Object> storage, Mutez balance)
{
    public static final EntityState EMPTY = new EntityState(List.of(), Mutez.ZERO);

    public EntityState {
        storage = List.copyOf(Objects.requireNonNull(storage, "storage"));
        Objects.requireNonNull(balance, "balance");
    }

    /**
     * Returns a new state with {@code value} appended to storage.
     */
    public EntityState withRecorded(Object value) {
        Objects.requireNonNull(value, "value");
        List<Object> updated = new ArrayList<>(storage);
        updated.add(value);
        return new EntityState(updated, balance);
    }

    /**
     * Returns a new state with {@code amount} credited.
     */
    public EntityState withCredit(Mutez amount) {
        return new EntityState(storage, balance.plus(amount));
    }

    public EntityState withBalance(Mutez newBalance) {
        return new EntityState(storage, newBalance);
    }
}
