package com.questrail.lockstep.compare;

import com.questrail.lockstep.api.Address;

import java.util.Optional;

/**
 * The observables compared after every step, in the order they are checked.
 */
public enum ObservableField
{
    PRIMARY_OUTCOME("storage"),
    PRIMARY_BALANCE("contract balance"),
    ENTITY_STORAGE("storage"),
    ENTITY_BALANCE("balance");

    private final String noun;

    ObservableField(String noun) {
        this.noun = noun;
    }

    public boolean isEntityField() {
        return this == ENTITY_STORAGE || this == ENTITY_BALANCE;
    }

    /**
     * Human-readable label used in report headers, e.g. {@code contract balance}
     * or {@code entity KT1abc storage}.
     */
    public String label(Optional<Address> entity) {
        if (isEntityField()) {
            return "entity " + entity.map(Address::value).orElse("?") + " " + noun;
        }
        return noun;
    }
}
