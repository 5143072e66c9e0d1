package com.questrail.lockstep.api;

/**
 * Roles an auxiliary entity can play in a run.
 *
 * <p>The generator needs these handles to build payloads (token transfers target
 * the governance token, registry lookups name the view consumer, ...). The engine
 * only needs them to decide which entities to track.</p>
 */
public enum EntityRole
{
    /** FA2 token contract used as governance token and general token sink. */
    GOVERNANCE_TOKEN,

    /** FA1.2 token contract. */
    FA12_TOKEN,

    /** Consumer contract receiving view/lookup callbacks. */
    VIEW_CONSUMER,

    /** Guardian contract allowed to drop proposals. */
    GUARDIAN
}
