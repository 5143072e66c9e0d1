package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;

import java.util.List;
import java.util.Objects;

/**
 * FA2 transfer batch item: tokens leave {@code from} towards each destination.
 *
 * <p>This is also the value a dummy FA2 entity records in its storage when it
 * receives a transfer call.</p>
 */
public record TokenTransfer(Address from, List<TransferDestination> destinations)
{
    public TokenTransfer {
        Objects.requireNonNull(from, "from");
        destinations = List.copyOf(Objects.requireNonNull(destinations, "destinations"));
    }
}
