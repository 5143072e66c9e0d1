package com.questrail.lockstep.model;

import java.util.List;
import java.util.Objects;

/**
 * Cast a batch of votes.
 */
public record Vote(List<VoteParam> votes) implements Entrypoint
{
    public Vote {
        votes = List.copyOf(Objects.requireNonNull(votes, "votes"));
    }

    @Override
    public Kind kind() {
        return Kind.VOTE;
    }
}
