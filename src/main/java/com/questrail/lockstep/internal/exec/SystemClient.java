package com.questrail.lockstep.internal.exec;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.api.Mutez;
import com.questrail.lockstep.internal.normalize.RawFailure;

import java.util.Optional;

/**
 * SystemClient
 * -----------------------------------------------------------------------------
 * Boundary to the real system under test (an emulator, a test network, a
 * sandboxed node).
 *
 * <h2>Role</h2>
 * The engine never talks to the system directly. Everything it needs, from
 * advancing the chain to reading back storages, goes through this interface.
 * Transport, wire encoding and origination are the implementation's concern.
 *
 * <h2>Failures</h2>
 * A call that the contract rejects is not an exception: {@link #call} and
 * {@link #transfer} return the raw failure payload. Exceptions thrown from any
 * method are treated as collaborator faults and abort the run.
 *
 * <p>Implementations may block. They are used from a single thread per run.</p>
 *
 * @param <S> primary storage type
 */
public interface SystemClient<S>
{
    /** Address of the primary contract under test. */
    Address primaryAddress();

    /** Current level (logical clock) of the system. */
    long currentLevel();

    /** Moves the system's clock forward by {@code levels}. */
    void advanceLevel(long levels);

    /**
     * Credits {@code amount} to {@code address} from the harness's own funds.
     */
    void fund(Address address, Mutez amount);

    /**
     * Submits a named entrypoint call to the primary contract from {@code sender}.
     *
     * @return the raw failure if the contract rejected the call, empty otherwise
     */
    Optional<RawFailure> call(Address sender, EntrypointCall call);

    /**
     * Transfers {@code amount} from {@code sender} to the primary contract's
     * default entrypoint.
     *
     * @return the raw failure if the contract rejected the transfer, empty otherwise
     */
    Optional<RawFailure> transfer(Address sender, Mutez amount);

    S primaryStorage();

    Mutez primaryBalance();

    /**
     * Reads back an auxiliary entity's storage and balance.
     *
     * @return empty if the system has no entity with that handle
     */
    Optional<EntityState> entityState(Address address);
}
