package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;

import java.util.Objects;

/**
 * One vote inside a {@link Vote} batch.
 */
public record VoteParam(ProposalKey proposalKey, boolean upvote, long voteAmount, Address from)
{
    public VoteParam {
        Objects.requireNonNull(proposalKey, "proposalKey");
        Objects.requireNonNull(from, "from");
        if (voteAmount < 0) {
            throw new IllegalArgumentException("voteAmount must be >= 0");
        }
    }
}
