package com.questrail.lockstep.compare;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.model.ObservableSet;
import com.questrail.lockstep.model.Operation;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ObservableComparator
 * -----------------------------------------------------------------------------
 * Compares the model's and the system's observable sets after one step.
 *
 * <h2>Check order</h2>
 * <ol>
 *   <li>{@link #checkPrimaryOutcome} - success storage or error code</li>
 *   <li>{@link #checkPrimaryBalance}</li>
 *   <li>{@link #checkEntityStorage} - every tracked entity, in tracking order</li>
 *   <li>{@link #checkEntityBalance} - every tracked entity, in tracking order</li>
 * </ol>
 * The first failing check wins. Each check can also be called on its own.
 *
 * <p>Comparison is structural ({@code equals}), pure and deterministic.
 * A success on one side and a failure on the other is a primary outcome
 * divergence.</p>
 */
public final class ObservableComparator
{
    public <S> Optional<DivergenceReport> compare(int step,
                                                  Operation operation,
                                                  ObservableSet<S> model,
                                                  ObservableSet<S> system)
    {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(system, "system");

        Optional<DivergenceReport> report = checkPrimaryOutcome(step, operation, model, system);
        if (report.isEmpty()) {
            report = checkPrimaryBalance(step, operation, model, system);
        }
        if (report.isEmpty()) {
            report = checkEntityStorage(step, operation, model, system);
        }
        if (report.isEmpty()) {
            report = checkEntityBalance(step, operation, model, system);
        }
        return report;
    }

    public <S> Optional<DivergenceReport> checkPrimaryOutcome(int step,
                                                              Operation operation,
                                                              ObservableSet<S> model,
                                                              ObservableSet<S> system)
    {
        if (model.primary().equals(system.primary())) {
            return Optional.empty();
        }
        return Optional.of(new DivergenceReport(step, operation, ObservableField.PRIMARY_OUTCOME,
                Optional.empty(), String.valueOf(model.primary()), String.valueOf(system.primary())));
    }

    public <S> Optional<DivergenceReport> checkPrimaryBalance(int step,
                                                              Operation operation,
                                                              ObservableSet<S> model,
                                                              ObservableSet<S> system)
    {
        if (model.primaryBalance().equals(system.primaryBalance())) {
            return Optional.empty();
        }
        return Optional.of(new DivergenceReport(step, operation, ObservableField.PRIMARY_BALANCE,
                Optional.empty(), model.primaryBalance().toString(), system.primaryBalance().toString()));
    }

    public <S> Optional<DivergenceReport> checkEntityStorage(int step,
                                                             Operation operation,
                                                             ObservableSet<S> model,
                                                             ObservableSet<S> system)
    {
        for (Map.Entry<Address, EntityState> e : model.entities().entrySet()) {
            EntityState other = system.entities().get(e.getKey());
            if (other == null || !e.getValue().storage().equals(other.storage())) {
                return Optional.of(new DivergenceReport(step, operation, ObservableField.ENTITY_STORAGE,
                        Optional.of(e.getKey()),
                        String.valueOf(e.getValue().storage()),
                        other == null ? "<missing>" : String.valueOf(other.storage())));
            }
        }
        return Optional.empty();
    }

    public <S> Optional<DivergenceReport> checkEntityBalance(int step,
                                                             Operation operation,
                                                             ObservableSet<S> model,
                                                             ObservableSet<S> system)
    {
        for (Map.Entry<Address, EntityState> e : model.entities().entrySet()) {
            EntityState other = system.entities().get(e.getKey());
            if (other == null || !e.getValue().balance().equals(other.balance())) {
                return Optional.of(new DivergenceReport(step, operation, ObservableField.ENTITY_BALANCE,
                        Optional.of(e.getKey()),
                        e.getValue().balance().toString(),
                        other == null ? "<missing>" : other.balance().toString()));
            }
        }
        return Optional.empty();
    }
}
