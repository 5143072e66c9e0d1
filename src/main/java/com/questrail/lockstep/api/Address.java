package com.questrail.lockstep.api;

import java.util.Objects;

/**
 * Address
 * -----------------------------------------------------------------------------
 * Opaque handle for an account or contract on the system under test.
 *
 * <p>Addresses are compared by value only. The engine never interprets the
 * textual form; it is whatever the collaborator uses ({@code tz1...},
 * {@code KT1...}, a test alias, etc.).</p>
 */
public record Address(String value) implements Comparable<Address>
{
    public Address {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
    }

    public static Address of(String value) {
        return new Address(value);
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
