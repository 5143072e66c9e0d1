package com.questrail.lockstep.internal.exec;

/**
 * What the system executor does with a custom call the configured dispatcher
 * does not define.
 */
public enum UnsupportedCustomPolicy
{
    /**
     * Treat the call as a successful submission that did nothing. The reference
     * model is expected to treat the call the same way.
     */
    NO_OP,

    /** Abort the run with a collaborator fault. */
    FAIL
}
