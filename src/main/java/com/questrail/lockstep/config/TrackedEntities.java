package com.questrail.lockstep.config;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.CollaboratorFault;
import com.questrail.lockstep.api.EntityRole;
import com.questrail.lockstep.api.Environment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The auxiliary entities whose storage and balance are compared after every
 * step, in comparison order.
 */
public record TrackedEntities(List<EntityRole> roles)
{
    public TrackedEntities {
        Objects.requireNonNull(roles, "roles");
        roles = List.copyOf(roles);
        Set<EntityRole> seen = new HashSet<>();
        for (EntityRole role : roles) {
            if (!seen.add(role)) {
                throw new IllegalArgumentException("Role tracked twice: " + role);
            }
        }
    }

    /** The governance token, then the view consumer. */
    public static TrackedEntities defaults() {
        return new TrackedEntities(List.of(EntityRole.GOVERNANCE_TOKEN, EntityRole.VIEW_CONSUMER));
    }

    public static TrackedEntities of(EntityRole... roles) {
        return new TrackedEntities(List.of(roles));
    }

    /**
     * Resolves the tracked roles to handles, in tracking order.
     *
     * @throws CollaboratorFault if the environment lacks a tracked role
     */
    public List<Address> resolve(Environment environment) {
        List<Address> handles = new ArrayList<>(roles.size());
        for (EntityRole role : roles) {
            Optional<Address> handle = environment.find(role);
            if (handle.isEmpty()) {
                throw new CollaboratorFault("Environment has no entity for tracked role " + role);
            }
            handles.add(handle.get());
        }
        return List.copyOf(handles);
    }
}
