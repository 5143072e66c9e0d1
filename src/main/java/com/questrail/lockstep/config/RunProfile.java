package com.questrail.lockstep.config;

import com.questrail.lockstep.api.ErrorCode;
import com.questrail.lockstep.api.Mutez;
import com.questrail.lockstep.internal.exec.CustomEntrypointDispatcher;
import com.questrail.lockstep.internal.exec.FundingPolicy;
import com.questrail.lockstep.internal.exec.UnsupportedCustomPolicy;
import com.questrail.lockstep.internal.normalize.ErrorNormalizer;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * RunProfile
 * -----------------------------------------------------------------------------
 * Per-variant configuration of a differential run.
 *
 * <p>A contract family ships in variants (plain, registry, treasury) that share
 * the governance core but differ in custom entrypoints and in the balance the
 * contract starts with. A profile captures those differences:</p>
 * <ul>
 *   <li><b>name</b> - used in run labels and replay bundle names</li>
 *   <li><b>initialBalance</b> - credited to the primary contract before the
 *       first step, on both sides</li>
 *   <li><b>dispatcher</b> and <b>unsupportedPolicy</b> - how custom calls reach
 *       the system</li>
 *   <li><b>funding</b> - nominal per-call funding of senders</li>
 *   <li><b>tracked</b> - auxiliary entities compared after every step</li>
 *   <li><b>timeoutCode</b> - error a system timeout normalizes to; empty makes a
 *       timeout a fault</li>
 * </ul>
 */
public record RunProfile(
    String name,
    Mutez initialBalance,
    CustomEntrypointDispatcher dispatcher,
    UnsupportedCustomPolicy unsupportedPolicy,
    FundingPolicy funding,
    TrackedEntities tracked,
    Optional<ErrorCode> timeoutCode
) {
    public RunProfile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(initialBalance, "initialBalance");
        Objects.requireNonNull(dispatcher, "dispatcher");
        Objects.requireNonNull(unsupportedPolicy, "unsupportedPolicy");
        Objects.requireNonNull(funding, "funding");
        Objects.requireNonNull(tracked, "tracked");
        Objects.requireNonNull(timeoutCode, "timeoutCode");
        if (name.isBlank() || !name.matches("[A-Za-z0-9._-]+")) {
            throw new IllegalArgumentException("profile name must be a non-blank file-name-safe token: '" + name + "'");
        }
    }

    /** Governance core without custom entrypoints, starting with an empty balance. */
    public static RunProfile base() {
        return builder("base").build();
    }

    /**
     * Registry variant: custom entrypoints named in {@code customEntrypoints} are
     * forwarded, the contract starts with 500 mutez.
     */
    public static RunProfile registry(Set<String> customEntrypoints) {
        return builder("registry")
                .withInitialBalance(Mutez.of(500))
                .withDispatcher(CustomEntrypointDispatcher.forwarding(customEntrypoints))
                .build();
    }

    /** Treasury variant: no custom entrypoints, the contract starts with 500 mutez. */
    public static RunProfile treasury() {
        return builder("treasury")
                .withInitialBalance(Mutez.of(500))
                .build();
    }

    public ErrorNormalizer normalizer() {
        return ErrorNormalizer.of(timeoutCode);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private Mutez initialBalance = Mutez.ZERO;
        private CustomEntrypointDispatcher dispatcher = CustomEntrypointDispatcher.none();
        private UnsupportedCustomPolicy unsupportedPolicy = UnsupportedCustomPolicy.NO_OP;
        private FundingPolicy funding = FundingPolicy.defaults();
        private TrackedEntities tracked = TrackedEntities.defaults();
        private ErrorCode timeoutCode;

        private Builder(String name) {
            this.name = name;
        }

        public Builder withInitialBalance(Mutez initialBalance) {
            this.initialBalance = initialBalance;
            return this;
        }

        public Builder withDispatcher(CustomEntrypointDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder withUnsupportedPolicy(UnsupportedCustomPolicy unsupportedPolicy) {
            this.unsupportedPolicy = unsupportedPolicy;
            return this;
        }

        public Builder withFunding(FundingPolicy funding) {
            this.funding = funding;
            return this;
        }

        public Builder withTracked(TrackedEntities tracked) {
            this.tracked = tracked;
            return this;
        }

        public Builder withTimeoutCode(ErrorCode timeoutCode) {
            this.timeoutCode = timeoutCode;
            return this;
        }

        public RunProfile build() {
            return new RunProfile(name, initialBalance, dispatcher, unsupportedPolicy, funding, tracked,
                    Optional.ofNullable(timeoutCode));
        }
    }
}
