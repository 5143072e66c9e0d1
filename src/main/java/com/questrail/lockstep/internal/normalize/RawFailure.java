package com.questrail.lockstep.internal.normalize;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Objects;

/**
 * RawFailure
 * -----------------------------------------------------------------------------
 * Failure payload exactly as the system under test reported it, before
 * normalization into an {@link com.questrail.lockstep.api.ErrorCode}.
 *
 * <p>Shapes:</p>
 * <ul>
 *   <li>{@link NumericCode} - the contract failed with a bare numeric tag</li>
 *   <li>{@link CodePair} - the contract failed with a pair whose first component
 *       is the tag (the second carries details)</li>
 *   <li>{@link Encoded} - the tag arrived wrapped in an untyped expression</li>
 *   <li>{@link Timeout} - the collaborator gave up waiting for the system</li>
 *   <li>{@link Unrecognized} - anything else; the collaborator's description is
 *       kept for diagnostics</li>
 * </ul>
 */
public sealed interface RawFailure
        permits RawFailure.NumericCode, RawFailure.CodePair, RawFailure.Encoded,
                RawFailure.Timeout, RawFailure.Unrecognized
{
    static RawFailure numeric(long code) {
        return new NumericCode(BigInteger.valueOf(code));
    }

    static RawFailure pair(RawFailure first, RawFailure second) {
        return new CodePair(first, second);
    }

    static RawFailure encoded(EncodedValue value) {
        return new Encoded(value);
    }

    record NumericCode(BigInteger code) implements RawFailure {
        public NumericCode {
            Objects.requireNonNull(code, "code");
        }
    }

    record CodePair(RawFailure first, RawFailure second) implements RawFailure {
        public CodePair {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
        }
    }

    record Encoded(EncodedValue value) implements RawFailure {
        public Encoded {
            Objects.requireNonNull(value, "value");
        }
    }

    record Timeout(Duration waited) implements RawFailure {
        public Timeout {
            Objects.requireNonNull(waited, "waited");
        }
    }

    record Unrecognized(String description) implements RawFailure {
        public Unrecognized {
            Objects.requireNonNull(description, "description");
        }
    }
}
