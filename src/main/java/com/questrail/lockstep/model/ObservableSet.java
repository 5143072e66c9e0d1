package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.api.Mutez;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ObservableSet
 * -----------------------------------------------------------------------------
 * The fixed tuple of values compared after every step.
 *
 * <ul>
 *   <li>{@code primary} - success storage or normalized error</li>
 *   <li>{@code primaryBalance} - balance of the primary contract</li>
 *   <li>{@code entities} - storage and balance of every tracked auxiliary
 *       entity, in tracking order</li>
 * </ul>
 *
 * <p>Both executors produce a value for every field; the entity map always holds
 * exactly the tracked handles.</p>
 *
 * @param <S> primary storage type
 */
public record ObservableSet<S>(Outcome<S> primary,
                               Mutez primaryBalance,
                               Map<Address, EntityState> entities)
{
    public ObservableSet {
        Objects.requireNonNull(primary, "primary");
        Objects.requireNonNull(primaryBalance, "primaryBalance");
        Objects.requireNonNull(entities, "entities");
        // LinkedHashMap keeps tracking order, which the comparator relies on.
        entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
    }
}
