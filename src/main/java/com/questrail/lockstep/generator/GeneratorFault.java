package com.questrail.lockstep.generator;

import com.questrail.lockstep.api.CollaboratorFault;

/**
 * The sequence generator failed or broke its contract (threw, returned nothing,
 * or returned more operations than the configured maximum).
 *
 * <p>A generator fault aborts the run before any operation is applied.</p>
 */
public final class GeneratorFault extends CollaboratorFault
{
    public GeneratorFault(String message) {
        super(message);
    }

    public GeneratorFault(String message, Throwable cause) {
        super(message, cause);
    }
}
