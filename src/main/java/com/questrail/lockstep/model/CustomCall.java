package com.questrail.lockstep.model;

import java.util.Objects;

/**
 * Call to a variant-specific custom entrypoint.
 */
public record CustomCall(CustomPayload payload) implements Entrypoint
{
    public CustomCall {
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public Kind kind() {
        return Kind.CUSTOM;
    }

    @Override
    public String entrypointName() {
        return payload.name();
    }
}
