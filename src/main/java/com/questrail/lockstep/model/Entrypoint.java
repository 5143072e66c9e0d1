package com.questrail.lockstep.model;

/**
 * Entrypoint
 * -----------------------------------------------------------------------------
 * Closed vocabulary of calls a generated {@link Operation} can make on the
 * primary contract.
 *
 * <h2>Exhaustive dispatch</h2>
 * Every variant reports a {@link Kind}. Code that must handle every variant
 * (the system executor, formatters) switches on {@link #kind()} with a switch
 * <em>expression</em>, so adding a variant without handling it fails to compile.
 *
 * <h2>Tez</h2>
 * Some entrypoints accept tez attached to the call; the others fail with
 * {@code FORBIDDEN_XTZ} on the contract when tez is attached. The engine does not
 * enforce this; it only exposes the flag to generators and models.
 */
public sealed interface Entrypoint
        permits Propose, Vote, Flush, Freeze, Unfreeze, UpdateDelegate, DropProposal,
                UnstakeVote, TransferContractTokens, TransferOwnership, AcceptOwnership,
                DefaultTransfer, CustomCall
{
    enum Kind {
        PROPOSE("propose", true),
        VOTE("vote", false),
        FLUSH("flush", false),
        FREEZE("freeze", false),
        UNFREEZE("unfreeze", false),
        UPDATE_DELEGATE("update_delegate", false),
        DROP_PROPOSAL("drop_proposal", false),
        UNSTAKE_VOTE("unstake_vote", false),
        TRANSFER_CONTRACT_TOKENS("transfer_contract_tokens", true),
        TRANSFER_OWNERSHIP("transfer_ownership", true),
        ACCEPT_OWNERSHIP("accept_ownership", true),
        DEFAULT("default", true),
        CUSTOM("custom", true);

        private final String entrypointName;
        private final boolean acceptsTez;

        Kind(String entrypointName, boolean acceptsTez) {
            this.entrypointName = entrypointName;
            this.acceptsTez = acceptsTez;
        }

        /**
         * Name of the entrypoint on the contract.
         */
        public String entrypointName() {
            return entrypointName;
        }

        public boolean acceptsTez() {
            return acceptsTez;
        }
    }

    Kind kind();

    /**
     * Entrypoint name used when submitting the call. Custom calls report the
     * custom payload's own name.
     */
    default String entrypointName() {
        return kind().entrypointName();
    }
}
