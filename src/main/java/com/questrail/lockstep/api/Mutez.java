package com.questrail.lockstep.api;

/**
 * Mutez
 * -----------------------------------------------------------------------------
 * Exact, non-negative monetary amount in the smallest unit (one millionth of a tez).
 *
 * <p>Balances must track exactly across both implementations, so all arithmetic
 * is overflow-checked and never rounds. Subtracting below zero is an error, not
 * a clamp.</p>
 */
public record Mutez(long value) implements Comparable<Mutez>
{
    public static final Mutez ZERO = new Mutez(0);
    public static final Mutez ONE = new Mutez(1);

    public Mutez {
        if (value < 0) {
            throw new IllegalArgumentException("mutez must be >= 0, was " + value);
        }
    }

    public static Mutez of(long value) {
        return value == 0 ? ZERO : new Mutez(value);
    }

    /**
     * @throws ArithmeticException if the sum does not fit in 64 bits
     */
    public Mutez plus(Mutez other) {
        return new Mutez(Math.addExact(value, other.value));
    }

    /**
     * @throws IllegalArgumentException if {@code other} is larger than this amount
     */
    public Mutez minus(Mutez other) {
        if (other.value > value) {
            throw new IllegalArgumentException("insufficient mutez: " + value + " < " + other.value);
        }
        return new Mutez(value - other.value);
    }

    public boolean isZero() {
        return value == 0;
    }

    public boolean isAtLeast(Mutez other) {
        return value >= other.value;
    }

    @Override
    public int compareTo(Mutez other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return value + " mutez";
    }
}
