package com.questrail.lockstep.internal.state;

import com.questrail.lockstep.api.ErrorCode;
import com.questrail.lockstep.model.Operation;

import java.util.Objects;
import java.util.Optional;

/**
 * ModelReducer
 * -----------------------------------------------------------------------------
 * Domain semantics of the reference model, supplied per contract variant.
 *
 * <p>Given a prior {@link ModelState} and one {@link Operation}, a reducer
 * computes the next state and, when the operation's preconditions are violated,
 * the {@link ErrorCode} the contract is expected to fail with.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Pure: no I/O, no clocks, no randomness.</li>
 *   <li>Total: every entrypoint variant has defined semantics. A violated
 *       precondition is an error result, never an exception.</li>
 *   <li>A failed call must return the state a failed transaction leaves behind
 *       (normally the prior state with the clock already advanced).</li>
 * </ul>
 *
 * <p>The clock has already been advanced when the reducer is called.</p>
 *
 * @param <S> primary storage type
 */
@FunctionalInterface
public interface ModelReducer<S>
{
    /**
     * Result of applying one operation.
     *
     * @param newState the updated model state
     * @param error    the expected failure, or empty for a successful call
     */
    record Result<S>(ModelState<S> newState, Optional<ErrorCode> error) {
        public Result {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(error, "error");
        }

        public static <S> Result<S> success(ModelState<S> newState) {
            return new Result<>(newState, Optional.empty());
        }

        public static <S> Result<S> failure(ModelState<S> unchanged, ErrorCode error) {
            return new Result<>(unchanged, Optional.of(error));
        }
    }

    Result<S> apply(ModelState<S> state, Operation operation);
}
