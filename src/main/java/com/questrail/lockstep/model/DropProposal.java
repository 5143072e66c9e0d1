package com.questrail.lockstep.model;

import java.util.Objects;

/**
 * Drop a proposal (proposer, guardian, or anyone once it has expired).
 */
public record DropProposal(ProposalKey proposalKey) implements Entrypoint
{
    public DropProposal {
        Objects.requireNonNull(proposalKey, "proposalKey");
    }

    @Override
    public Kind kind() {
        return Kind.DROP_PROPOSAL;
    }
}
