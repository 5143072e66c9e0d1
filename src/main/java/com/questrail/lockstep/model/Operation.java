package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.Mutez;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Operation
 * -----------------------------------------------------------------------------
 * One generated call, applied to both the reference model and the system under
 * test within a single step.
 *
 * <p>An operation carries:</p>
 * <ul>
 *   <li>the {@code sender} the call is made from</li>
 *   <li>the {@code amount} of tez attached to the call</li>
 *   <li>an optional {@code advance} directive: move the shared logical clock
 *       forward by that many levels <em>before</em> the call is evaluated</li>
 *   <li>the {@link Entrypoint} being called, with its typed payload</li>
 * </ul>
 *
 * Operations are immutable once generated.
 */
public record Operation(Address sender, Mutez amount, OptionalLong advance, Entrypoint entrypoint)
{
    public Operation {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(advance, "advance");
        Objects.requireNonNull(entrypoint, "entrypoint");
        if (advance.isPresent() && advance.getAsLong() < 0) {
            throw new IllegalArgumentException("advance must be >= 0");
        }
    }

    /**
     * Call without tez and without advancing the clock.
     */
    public static Operation call(Address sender, Entrypoint entrypoint) {
        return new Operation(sender, Mutez.ZERO, OptionalLong.empty(), entrypoint);
    }

    public Operation withAdvance(long levels) {
        return new Operation(sender, amount, OptionalLong.of(levels), entrypoint);
    }

    public Operation withAmount(Mutez newAmount) {
        return new Operation(sender, newAmount, advance, entrypoint);
    }

    public Entrypoint.Kind kind() {
        return entrypoint.kind();
    }
}
