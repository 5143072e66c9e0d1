package com.questrail.lockstep.internal.normalize;

/**
 * Raised when a system failure cannot be mapped into the shared error taxonomy.
 *
 * <p>This indicates the normalizer is out of date with the system's error
 * encoding. It is fatal for the whole run and is never turned into a
 * divergence report.</p>
 */
public final class NormalizationFault extends RuntimeException
{
    private final transient RawFailure failure;

    public NormalizationFault(String message, RawFailure failure) {
        super(message + ": " + failure);
        this.failure = failure;
    }

    /**
     * The payload that could not be normalized.
     */
    public RawFailure failure() {
        return failure;
    }
}
