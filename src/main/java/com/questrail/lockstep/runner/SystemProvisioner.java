package com.questrail.lockstep.runner;

import com.questrail.lockstep.config.RunProfile;
import com.questrail.lockstep.internal.exec.SystemClient;
import com.questrail.lockstep.model.Sequence;

/**
 * Brings up a fresh system under test for one run.
 *
 * <p>Implementations originate the primary contract with the sequence's
 * initial storage and the auxiliary entities named in its environment, at the
 * handles the environment declares. Every call must return an independent
 * client: parallel runs never share system state.</p>
 *
 * <p>Any exception is treated as a collaborator fault and aborts the run
 * before the first step.</p>
 *
 * @param <S> primary storage type
 */
@FunctionalInterface
public interface SystemProvisioner<S>
{
    SystemClient<S> provision(Sequence<S> sequence, RunProfile profile);
}
