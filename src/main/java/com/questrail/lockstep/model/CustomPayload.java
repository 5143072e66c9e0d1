package com.questrail.lockstep.model;

/**
 * Payload of a contract-variant specific entrypoint (registry lookups, treasury
 * proposals, ...).
 *
 * <p>Implementations are supplied per variant and must be immutable value types.
 * The engine never inspects them; a
 * {@link com.questrail.lockstep.internal.exec.CustomEntrypointDispatcher} decides
 * how (and whether) they reach the system under test.</p>
 */
public interface CustomPayload
{
    /**
     * Entrypoint name on the contract, e.g. {@code lookup_registry}.
     */
    String name();
}
