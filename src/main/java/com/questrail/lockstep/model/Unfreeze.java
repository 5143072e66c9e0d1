package com.questrail.lockstep.model;

/**
 * Unfreeze {@code amount} previously frozen governance tokens of the sender.
 */
public record Unfreeze(long amount) implements Entrypoint
{
    public Unfreeze {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
    }

    @Override
    public Kind kind() {
        return Kind.UNFREEZE;
    }
}
