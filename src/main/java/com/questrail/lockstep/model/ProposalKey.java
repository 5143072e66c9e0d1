package com.questrail.lockstep.model;

import java.util.Objects;

/**
 * Identifier of a proposal (hash of its packed content on the contract).
 */
public record ProposalKey(String value)
{
    public ProposalKey {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
