package com.questrail.lockstep.model;

import com.questrail.lockstep.api.Address;

import java.util.Objects;

/**
 * Enable or disable {@code delegate} as a delegate of the sender.
 */
public record DelegateParam(boolean enable, Address delegate)
{
    public DelegateParam {
        Objects.requireNonNull(delegate, "delegate");
    }
}
