package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;

import java.util.List;
import java.util.Objects;

/**
 * Admin-only: make the primary contract call {@code transfer} on the FA2
 * contract at {@code contractAddress} with {@code transfers}.
 */
public record TransferContractTokens(Address contractAddress, List<TokenTransfer> transfers)
        implements Entrypoint
{
    public TransferContractTokens {
        Objects.requireNonNull(contractAddress, "contractAddress");
        transfers = List.copyOf(Objects.requireNonNull(transfers, "transfers"));
    }

    @Override
    public Kind kind() {
        return Kind.TRANSFER_CONTRACT_TOKENS;
    }
}
