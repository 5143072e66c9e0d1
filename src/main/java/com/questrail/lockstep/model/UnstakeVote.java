package com.questrail.lockstep.model;

import java.util.List;
import java.util.Objects;

/**
 * Release the sender's staked votes on already-processed proposals.
 */
public record UnstakeVote(List<ProposalKey> proposalKeys) implements Entrypoint
{
    public UnstakeVote {
        proposalKeys = List.copyOf(Objects.requireNonNull(proposalKeys, "proposalKeys"));
    }

    @Override
    public Kind kind() {
        return Kind.UNSTAKE_VOTE;
    }
}
