package com.questrail.lockstep.internal.normalize;

import java.math.BigInteger;
import java.util.Objects;

/**
 * EncodedValue
 * -----------------------------------------------------------------------------
 * Untyped expression tree a system may fail with (the equivalent of an untyped
 * Micheline value). Only the shapes the normalizer understands are modelled;
 * everything else is reported by the collaborator as
 * {@link RawFailure.Unrecognized}.
 */
public sealed interface EncodedValue
        permits EncodedValue.IntValue, EncodedValue.StringValue, EncodedValue.PairValue
{
    static EncodedValue integer(long value) {
        return new IntValue(BigInteger.valueOf(value));
    }

    static EncodedValue string(String value) {
        return new StringValue(value);
    }

    static EncodedValue pair(EncodedValue left, EncodedValue right) {
        return new PairValue(left, right);
    }

    record IntValue(BigInteger value) implements EncodedValue {
        public IntValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record StringValue(String value) implements EncodedValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record PairValue(EncodedValue left, EncodedValue right) implements EncodedValue {
        public PairValue {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }
}
