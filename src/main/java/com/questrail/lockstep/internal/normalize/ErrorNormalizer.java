package com.questrail.lockstep.internal.normalize;

import com.questrail.lockstep.api.ErrorCode;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * ErrorNormalizer
 * -----------------------------------------------------------------------------
 * Maps system failure payloads into the {@link ErrorCode} space used by the
 * reference model.
 *
 * <h2>Rules, in priority order</h2>
 * <ol>
 *   <li>A single numeric code maps through {@link ErrorCode#fromCode}.</li>
 *   <li>A pair maps its first component through rule 1.</li>
 *   <li>An encoded expression is decoded: an integer is rule 1, a pair whose
 *       left side is an integer is rule 2.</li>
 *   <li>Anything else is a {@link NormalizationFault}. This includes numeric
 *       codes missing from the taxonomy and timeouts when no timeout mapping
 *       was configured.</li>
 * </ol>
 *
 * <p>The normalizer never guesses. Coercing an unknown payload to some default
 * error would hide real divergences.</p>
 */
public final class ErrorNormalizer
{
    private final ErrorCode timeoutCode;

    private ErrorNormalizer(ErrorCode timeoutCode) {
        this.timeoutCode = timeoutCode;
    }

    /**
     * Normalizer that treats timeouts as faults.
     */
    public static ErrorNormalizer strict() {
        return new ErrorNormalizer(null);
    }

    /**
     * Normalizer that maps timeouts to {@code timeoutCode}.
     */
    public static ErrorNormalizer mappingTimeoutsTo(ErrorCode timeoutCode) {
        return new ErrorNormalizer(Objects.requireNonNull(timeoutCode, "timeoutCode"));
    }

    public static ErrorNormalizer of(Optional<ErrorCode> timeoutCode) {
        return new ErrorNormalizer(timeoutCode.orElse(null));
    }

    public Optional<ErrorCode> timeoutCode() {
        return Optional.ofNullable(timeoutCode);
    }

    /**
     * @throws NormalizationFault if the payload has no mapping
     */
    public ErrorCode normalize(RawFailure failure) {
        Objects.requireNonNull(failure, "failure");

        if (failure instanceof RawFailure.NumericCode n) {
            return byCode(n.code(), failure);
        }
        if (failure instanceof RawFailure.CodePair p
                && p.first() instanceof RawFailure.NumericCode first) {
            return byCode(first.code(), failure);
        }
        if (failure instanceof RawFailure.Encoded e) {
            return decode(e.value(), failure);
        }
        if (failure instanceof RawFailure.Timeout && timeoutCode != null) {
            return timeoutCode;
        }

        throw new NormalizationFault("Unexpected failure shape", failure);
    }

    private static ErrorCode decode(EncodedValue value, RawFailure original) {
        if (value instanceof EncodedValue.IntValue i) {
            return byCode(i.value(), original);
        }
        if (value instanceof EncodedValue.PairValue p
                && p.left() instanceof EncodedValue.IntValue left) {
            return byCode(left.value(), original);
        }
        throw new NormalizationFault("Unexpected encoded failure", original);
    }

    private static ErrorCode byCode(BigInteger code, RawFailure original) {
        return ErrorCode.fromCode(code)
                .orElseThrow(() -> new NormalizationFault("Unknown error tag " + code, original));
    }
}
