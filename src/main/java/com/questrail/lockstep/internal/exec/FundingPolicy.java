package com.questrail.lockstep.internal.exec;

import com.questrail.lockstep.api.Mutez;

import java.util.Objects;

/**
 * Nominal amount credited to the sender before every submission, so that a
 * fresh sender account exists and can pay for its call.
 *
 * <p>The funding goes to the sender only. A sender whose balance is compared
 * (the primary contract or a tracked entity) is never funded, so the credit
 * does not appear in any compared balance.</p>
 */
public record FundingPolicy(Mutez perCall)
{
    public FundingPolicy {
        Objects.requireNonNull(perCall, "perCall");
    }

    /** One mutez per call. */
    public static FundingPolicy defaults() {
        return new FundingPolicy(Mutez.ONE);
    }

    public static FundingPolicy none() {
        return new FundingPolicy(Mutez.ZERO);
    }

    public boolean isEnabled() {
        return !perCall.isZero();
    }
}
