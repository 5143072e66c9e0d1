package com.questrail.lockstep.model;

/**
 * Freeze {@code amount} governance tokens of the sender.
 */
public record Freeze(long amount) implements Entrypoint
{
    public Freeze {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
    }

    @Override
    public Kind kind() {
        return Kind.FREEZE;
    }
}
