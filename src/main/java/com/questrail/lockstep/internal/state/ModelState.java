package com.questrail.lockstep.internal.state;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.CollaboratorFault;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.api.Mutez;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * ModelState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the reference model's complete state.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>the primary contract's own address, storage and balance</li>
 *   <li>the sub-state of every auxiliary entity, keyed by its handle</li>
 *   <li>the current logical clock (level)</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * Snapshots are values. The {@link ModelExecutor} holds the current one and
 * replaces it only while applying an operation; reducers derive new snapshots
 * through the {@code with*} methods and never share mutable structure.
 *
 * @param <S> primary storage type
 */
public final class ModelState<S>
{
    private final Address selfAddress;
    private final S storage;
    private final Mutez balance;
    private final Map<Address, EntityState> entities;
    private final long level;

    private ModelState(Address selfAddress,
                       S storage,
                       Mutez balance,
                       Map<Address, EntityState> entities,
                       long level) {
        this.selfAddress = Objects.requireNonNull(selfAddress, "selfAddress");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.balance = Objects.requireNonNull(balance, "balance");
        this.entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        if (level < 0) {
            throw new IllegalArgumentException("level must be >= 0");
        }
        this.level = level;
    }

    public static <S> ModelState<S> of(Address selfAddress,
                                       S storage,
                                       Mutez balance,
                                       Map<Address, EntityState> entities,
                                       long level) {
        return new ModelState<>(selfAddress, storage, balance, entities, level);
    }

    public Address selfAddress() {
        return selfAddress;
    }

    public S storage() {
        return storage;
    }

    public Mutez balance() {
        return balance;
    }

    /**
     * Returns an immutable view of auxiliary entity sub-states keyed by handle.
     */
    public Map<Address, EntityState> entities() {
        return entities;
    }

    public Optional<EntityState> entity(Address handle) {
        return Optional.ofNullable(entities.get(handle));
    }

    public long level() {
        return level;
    }

    // ---------------------------------------------------------------------
    // Derivation
    // ---------------------------------------------------------------------

    public ModelState<S> withStorage(S newStorage) {
        return new ModelState<>(selfAddress, newStorage, balance, entities, level);
    }

    public ModelState<S> withBalance(Mutez newBalance) {
        return new ModelState<>(selfAddress, storage, newBalance, entities, level);
    }

    public ModelState<S> withLevel(long newLevel) {
        return new ModelState<>(selfAddress, storage, balance, entities, newLevel);
    }

    /**
     * Moves the logical clock forward.
     */
    public ModelState<S> advancedBy(long levels) {
        if (levels < 0) {
            throw new IllegalArgumentException("Cannot move the clock backwards");
        }
        return withLevel(Math.addExact(level, levels));
    }

    /**
     * Returns a new state with one entity sub-state replaced (or added).
     */
    public ModelState<S> withEntity(Address handle, EntityState state) {
        Map<Address, EntityState> updated = new LinkedHashMap<>(entities);
        updated.put(Objects.requireNonNull(handle, "handle"),
                Objects.requireNonNull(state, "state"));
        return new ModelState<>(selfAddress, storage, balance, updated, level);
    }

    /**
     * Returns a new state with an existing entity's sub-state transformed.
     *
     * @throws CollaboratorFault if the entity does not exist
     */
    public ModelState<S> updateEntity(Address handle, UnaryOperator<EntityState> update) {
        EntityState current = entities.get(handle);
        if (current == null) {
            throw new CollaboratorFault("Entity " + handle + " does not exist in the model");
        }
        return withEntity(handle, update.apply(current));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelState<?> that)) return false;
        return level == that.level
                && selfAddress.equals(that.selfAddress)
                && storage.equals(that.storage)
                && balance.equals(that.balance)
                && entities.equals(that.entities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selfAddress, storage, balance, entities, level);
    }

    @Override
    public String toString() {
        return "ModelState{self=" + selfAddress
                + ", level=" + level
                + ", balance=" + balance
                + ", storage=" + storage
                + ", entities=" + entities + '}';
    }
}
