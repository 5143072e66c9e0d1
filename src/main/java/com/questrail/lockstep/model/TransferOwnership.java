package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;

import java.util.Objects;

/**
 * Admin-only: nominate {@code newOwner} as pending administrator.
 */
public record TransferOwnership(Address newOwner) implements Entrypoint
{
    public TransferOwnership {
        Objects.requireNonNull(newOwner, "newOwner");
    }

    @Override
    public Kind kind() {
        return Kind.TRANSFER_OWNERSHIP;
    }
}
