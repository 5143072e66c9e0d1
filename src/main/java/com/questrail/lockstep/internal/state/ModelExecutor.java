package com.questrail.lockstep.internal.state;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.CollaboratorFault;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.model.ObservableSet;
import com.questrail.lockstep.model.Operation;
import com.questrail.lockstep.model.Outcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ModelExecutor
 * -----------------------------------------------------------------------------
 * Applies operations to the reference model, one at a time.
 *
 * <h2>Step semantics</h2>
 * <pre>
 *   advance clock (if requested) → reducer → new state → observable projection
 * </pre>
 *
 * <p>The executor owns the current {@link ModelState}. It is synchronous and never
 * blocks. Anything thrown by the reducer is a {@link CollaboratorFault}: the
 * model is required to be total, so an exception means the run's premises are
 * broken, not that the two implementations disagree.</p>
 *
 * @param <S> primary storage type
 */
public final class ModelExecutor<S>
{
    /**
     * Result of one model step.
     */
    public record Step<S>(ModelState<S> newState, ObservableSet<S> observables) {}

    private final ModelReducer<S> reducer;
    private final List<Address> tracked;

    private ModelState<S> state;

    public ModelExecutor(ModelState<S> initialState,
                         ModelReducer<S> reducer,
                         List<Address> tracked)
    {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.tracked = List.copyOf(Objects.requireNonNull(tracked, "tracked"));
    }

    /**
     * Applies one operation to the current state and makes the result current.
     */
    public ObservableSet<S> apply(Operation operation) {
        Step<S> step = apply(state, operation);
        this.state = step.newState();
        return step.observables();
    }

    /**
     * Applies one operation to an explicit state without touching the executor's
     * current state.
     */
    public Step<S> apply(ModelState<S> from, Operation operation) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(operation, "operation");

        ModelReducer.Result<S> result;
        try {
            ModelState<S> advanced = operation.advance().isPresent()
                    ? from.advancedBy(operation.advance().getAsLong())
                    : from;
            result = reducer.apply(advanced, operation);
        } catch (CollaboratorFault e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFault(
                    "Reference model failed on " + operation.kind() + ": " + e.getMessage(), e);
        }
        if (result == null) {
            throw new CollaboratorFault("Reference model returned no result for " + operation.kind());
        }

        ModelState<S> next = result.newState();
        Outcome<S> primary = result.error()
                .<Outcome<S>>map(Outcome::failure)
                .orElseGet(() -> Outcome.success(next.storage()));

        return new Step<>(next, new ObservableSet<>(primary, next.balance(), project(next)));
    }

    private Map<Address, EntityState> project(ModelState<S> s) {
        Map<Address, EntityState> out = new LinkedHashMap<>();
        for (Address handle : tracked) {
            EntityState entity = s.entities().get(handle);
            if (entity == null) {
                throw new CollaboratorFault("Tracked entity " + handle + " does not exist in the model");
            }
            out.put(handle, entity);
        }
        return out;
    }

    public ModelState<S> state() {
        return state;
    }

    public List<Address> tracked() {
        return tracked;
    }
}
