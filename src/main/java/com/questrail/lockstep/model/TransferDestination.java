package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;

import java.util.Objects;

/**
 * Destination leg of an FA2 transfer.
 */
public record TransferDestination(Address to, long tokenId, long amount)
{
    public TransferDestination {
        Objects.requireNonNull(to, "to");
        if (tokenId < 0 || amount < 0) {
            throw new IllegalArgumentException("tokenId and amount must be >= 0");
        }
    }
}
