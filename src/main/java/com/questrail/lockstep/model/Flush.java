package com.questrail.lockstep.model;

/**
 * Process up to {@code count} proposals whose voting period has ended.
 */
public record Flush(int count) implements Entrypoint
{
    public Flush {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
    }

    @Override
    public Kind kind() {
        return Kind.FLUSH;
    }
}
