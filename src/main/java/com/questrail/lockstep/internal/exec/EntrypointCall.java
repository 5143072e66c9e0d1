package com.questrail.lockstep.internal.exec;

import com.questrail.lockstep.api.Mutez;
import com.questrail.lockstep.model.Entrypoint;

import java.util.Objects;

/**
 * A named entrypoint call as submitted to the system under test.
 *
 * @param name     entrypoint name on the contract
 * @param argument typed payload; encoding it is the client's business
 * @param amount   tez attached to the call
 */
public record EntrypointCall(String name, Entrypoint argument, Mutez amount)
{
    public EntrypointCall {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(argument, "argument");
        Objects.requireNonNull(amount, "amount");
        if (name.isBlank()) {
            throw new IllegalArgumentException("entrypoint name must not be blank");
        }
    }
}
