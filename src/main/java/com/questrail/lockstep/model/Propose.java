package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;

import java.util.Objects;

/**
 * Submit a new proposal, freezing {@code frozenToken} tokens of the proposer.
 *
 * @param from        address the proposal is made on behalf of
 * @param frozenToken tokens staked on the proposal
 * @param metadata    proposal payload, opaque to the engine
 */
public record Propose(Address from, long frozenToken, Object metadata) implements Entrypoint
{
    public Propose {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(metadata, "metadata");
        if (frozenToken < 0) {
            throw new IllegalArgumentException("frozenToken must be >= 0");
        }
    }

    @Override
    public Kind kind() {
        return Kind.PROPOSE;
    }
}
