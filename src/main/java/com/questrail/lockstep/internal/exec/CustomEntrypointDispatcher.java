package com.questrail.lockstep.internal.exec;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.internal.normalize.RawFailure;
import com.questrail.lockstep.model.CustomCall;
import com.questrail.lockstep.model.Operation;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CustomEntrypointDispatcher
 * -----------------------------------------------------------------------------
 * Strategy for submitting domain-specific custom calls to the system under test.
 *
 * <p>Each contract variant defines its own custom entrypoints (a registry has
 * lookups and updates, a treasury has none). The dispatcher for the variant is
 * resolved once per run profile and injected into the {@link SystemExecutor}.</p>
 *
 * <p>A dispatcher reports {@link Dispatch#unsupported()} for any sub-variant it
 * does not define; the executor then applies the configured
 * {@link UnsupportedCustomPolicy}.</p>
 */
@FunctionalInterface
public interface CustomEntrypointDispatcher
{
    /**
     * Result of a dispatch attempt.
     */
    sealed interface Dispatch permits Dispatch.Submitted, Dispatch.Unsupported {

        static Dispatch submitted(Optional<RawFailure> failure) {
            return new Submitted(failure);
        }

        static Dispatch unsupported() {
            return Unsupported.INSTANCE;
        }

        /** The call reached the system; {@code failure} is its raw rejection, if any. */
        record Submitted(Optional<RawFailure> failure) implements Dispatch {
            public Submitted {
                Objects.requireNonNull(failure, "failure");
            }
        }

        /** The dispatcher does not know this custom sub-variant. */
        enum Unsupported implements Dispatch {
            INSTANCE
        }
    }

    Dispatch dispatch(SystemClient<?> client, Operation operation, CustomCall call);

    /**
     * Dispatcher for variants without custom entrypoints.
     */
    static CustomEntrypointDispatcher none() {
        return (client, operation, call) -> Dispatch.unsupported();
    }

    /**
     * Dispatcher that forwards custom calls whose payload name is in
     * {@code names} as plain entrypoint calls, and reports every other name as
     * unsupported.
     */
    static CustomEntrypointDispatcher forwarding(Set<String> names) {
        Set<String> supported = Set.copyOf(names);
        return (client, operation, call) -> {
            String name = call.entrypointName();
            if (!supported.contains(name)) {
                return Dispatch.unsupported();
            }
            Address sender = operation.sender();
            return Dispatch.submitted(
                    client.call(sender, new EntrypointCall(name, call, operation.amount())));
        };
    }
}
