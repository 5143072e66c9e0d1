package com.questrail.lockstep.api;

/**
 * Raised when a collaborator (generator, reference model, system client,
 * provisioner) breaks the premises of a run: a missing auxiliary entity, an
 * unresolvable handle, a reducer that throws instead of returning an error.
 *
 * <p>Collaborator faults are fatal. They abort the run and are never reported as
 * a divergence between the two implementations.</p>
 */
public class CollaboratorFault extends RuntimeException
{
    public CollaboratorFault(String message) {
        super(message);
    }

    public CollaboratorFault(String message, Throwable cause) {
        super(message, cause);
    }
}
