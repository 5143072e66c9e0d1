package com.questrail.lockstep.internal.exec;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.CollaboratorFault;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.api.Mutez;
import com.questrail.lockstep.internal.normalize.ErrorNormalizer;
import com.questrail.lockstep.internal.normalize.RawFailure;
import com.questrail.lockstep.model.CustomCall;
import com.questrail.lockstep.model.ObservableSet;
import com.questrail.lockstep.model.Operation;
import com.questrail.lockstep.model.Outcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * SystemExecutor
 * -----------------------------------------------------------------------------
 * Applies operations to the real system under test through a
 * {@link SystemClient}.
 *
 * <h2>One step</h2>
 * <ol>
 *   <li>advance the system's clock, if the operation asks for it</li>
 *   <li>fund the sender per {@link FundingPolicy}, unless the sender is the
 *       primary contract or a tracked entity</li>
 *   <li>submit the call: named entrypoint, default transfer or custom dispatch</li>
 *   <li>read back primary storage, primary balance and every tracked entity</li>
 * </ol>
 * Submission and read-back form one logical unit; nothing else touches the
 * system in between.
 *
 * <h2>Failures</h2>
 * A rejected call is data: its raw payload is normalized through the
 * {@link ErrorNormalizer} into the primary {@link Outcome}. Exceptions from the
 * client, unknown entity handles and unsupported custom calls under
 * {@link UnsupportedCustomPolicy#FAIL} are {@link CollaboratorFault}s.
 * A payload the normalizer cannot map surfaces as a
 * {@link com.questrail.lockstep.internal.normalize.NormalizationFault}.
 */
public final class SystemExecutor<S>
{
    /**
     * Result of one system step.
     *
     * @param rawFailure  the failure exactly as reported, empty on success
     * @param observables the normalized observable set
     */
    public record Step<S>(Optional<RawFailure> rawFailure, ObservableSet<S> observables) {}

    private final SystemClient<S> client;
    private final ErrorNormalizer normalizer;
    private final CustomEntrypointDispatcher dispatcher;
    private final UnsupportedCustomPolicy unsupportedPolicy;
    private final FundingPolicy funding;
    private final List<Address> tracked;

    public SystemExecutor(SystemClient<S> client,
                          ErrorNormalizer normalizer,
                          CustomEntrypointDispatcher dispatcher,
                          UnsupportedCustomPolicy unsupportedPolicy,
                          FundingPolicy funding,
                          List<Address> tracked)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.unsupportedPolicy = Objects.requireNonNull(unsupportedPolicy, "unsupportedPolicy");
        this.funding = Objects.requireNonNull(funding, "funding");
        this.tracked = List.copyOf(Objects.requireNonNull(tracked, "tracked"));
    }

    public Step<S> apply(Operation operation) {
        Objects.requireNonNull(operation, "operation");

        Optional<RawFailure> failure;
        try {
            if (operation.advance().isPresent()) {
                client.advanceLevel(operation.advance().getAsLong());
            }
            if (funding.isEnabled() && !isCompared(operation.sender())) {
                client.fund(operation.sender(), funding.perCall());
            }
            failure = submit(operation);
        } catch (CollaboratorFault e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFault("System client failed while submitting " + operation.kind(), e);
        }
        if (failure == null) {
            throw new CollaboratorFault("System client returned no result for " + operation.kind());
        }

        Outcome<S> primary = failure.isPresent()
                ? Outcome.failure(normalizer.normalize(failure.get()))
                : Outcome.success(fetch("primary storage", client::primaryStorage));
        Mutez balance = fetch("primary balance", client::primaryBalance);
        Map<Address, EntityState> entities = fetchEntities();

        return new Step<>(failure, new ObservableSet<>(primary, balance, entities));
    }

    private Optional<RawFailure> submit(Operation operation) {
        Address sender = operation.sender();
        return switch (operation.kind()) {
            case PROPOSE, VOTE, FLUSH, FREEZE, UNFREEZE, UPDATE_DELEGATE, DROP_PROPOSAL,
                 UNSTAKE_VOTE, TRANSFER_CONTRACT_TOKENS, TRANSFER_OWNERSHIP, ACCEPT_OWNERSHIP ->
                    client.call(sender, new EntrypointCall(
                            operation.entrypoint().entrypointName(),
                            operation.entrypoint(),
                            operation.amount()));
            case DEFAULT -> client.transfer(sender, operation.amount());
            case CUSTOM -> submitCustom(operation, (CustomCall) operation.entrypoint());
        };
    }

    private Optional<RawFailure> submitCustom(Operation operation, CustomCall call) {
        CustomEntrypointDispatcher.Dispatch dispatch = dispatcher.dispatch(client, operation, call);
        if (dispatch == null) {
            throw new CollaboratorFault("Dispatcher returned no result for custom entrypoint '"
                    + call.entrypointName() + "'");
        }
        if (dispatch instanceof CustomEntrypointDispatcher.Dispatch.Submitted submitted) {
            return submitted.failure();
        }
        if (unsupportedPolicy == UnsupportedCustomPolicy.FAIL) {
            throw new CollaboratorFault("Custom entrypoint '" + call.entrypointName()
                    + "' is not supported by the configured dispatcher");
        }
        return Optional.empty();
    }

    // Funding an account whose balance is compared would show up as a divergence.
    private boolean isCompared(Address sender) {
        return sender.equals(client.primaryAddress()) || tracked.contains(sender);
    }

    private Map<Address, EntityState> fetchEntities() {
        Map<Address, EntityState> out = new LinkedHashMap<>();
        for (Address handle : tracked) {
            Optional<EntityState> state = fetch("entity " + handle, () -> client.entityState(handle));
            if (state.isEmpty()) {
                throw new CollaboratorFault("Tracked entity " + handle + " does not exist in the system");
            }
            out.put(handle, state.get());
        }
        return out;
    }

    private static <T> T fetch(String what, Supplier<T> read) {
        T value;
        try {
            value = read.get();
        } catch (CollaboratorFault e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorFault("System client failed to read " + what, e);
        }
        if (value == null) {
            throw new CollaboratorFault("System client returned no " + what);
        }
        return value;
    }

    public SystemClient<S> client() {
        return client;
    }

    public List<Address> tracked() {
        return tracked;
    }
}
