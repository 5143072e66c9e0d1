package com.questrail.lockstep.api;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Environment
 * -----------------------------------------------------------------------------
 * Handles of the auxiliary entities a sequence refers to, keyed by role.
 *
 * <p>Created once per run, read-only afterwards.</p>
 */
public final class Environment
{
    private final Map<EntityRole, Address> handles;

    private Environment(Map<EntityRole, Address> handles) {
        this.handles = handles.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(handles));
    }

    public static Environment empty() {
        return new Environment(Map.of());
    }

    /**
     * Returns the handle for {@code role}.
     *
     * @throws IllegalArgumentException if the environment has no entity for the role
     */
    public Address require(EntityRole role) {
        Address address = handles.get(Objects.requireNonNull(role, "role"));
        if (address == null) {
            throw new IllegalArgumentException("No entity for role " + role);
        }
        return address;
    }

    public Optional<Address> find(EntityRole role) {
        return Optional.ofNullable(handles.get(role));
    }

    public Map<EntityRole, Address> handles() {
        return handles;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Environment that)) return false;
        return handles.equals(that.handles);
    }

    @Override
    public int hashCode() {
        return handles.hashCode();
    }

    @Override
    public String toString() {
        return "Environment" + handles;
    }

    public static final class Builder {
        private final Map<EntityRole, Address> handles = new EnumMap<>(EntityRole.class);

        private Builder() {}

        public Builder with(EntityRole role, Address address) {
            handles.put(Objects.requireNonNull(role, "role"),
                    Objects.requireNonNull(address, "address"));
            return this;
        }

        public Environment build() {
            return new Environment(handles);
        }
    }
}
