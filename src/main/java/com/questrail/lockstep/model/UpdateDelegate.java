package com.questrail.lockstep.model;

import java.util.List;
import java.util.Objects;

/**
 * Update the sender's delegates.
 */
public record UpdateDelegate(List<DelegateParam> updates) implements Entrypoint
{
    public UpdateDelegate {
        updates = List.copyOf(Objects.requireNonNull(updates, "updates"));
    }

    @Override
    public Kind kind() {
        return Kind.UPDATE_DELEGATE;
    }
}
