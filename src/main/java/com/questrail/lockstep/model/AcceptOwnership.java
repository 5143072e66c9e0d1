package com.questrail.lockstep.model;

/**
 * Pending administrator accepts ownership.
 */
public record AcceptOwnership() implements Entrypoint
{
    @Override
    public Kind kind() {
        return Kind.ACCEPT_OWNERSHIP;
    }
}
