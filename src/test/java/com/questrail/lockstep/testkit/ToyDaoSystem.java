package com.questrail.lockstep.testkit;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.EntityRole;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.api.Environment;
import com.questrail.lockstep.api.ErrorCode;
import com.questrail.lockstep.api.Mutez;
import com.questrail.lockstep.internal.exec.EntrypointCall;
import com.questrail.lockstep.internal.exec.SystemClient;
import com.questrail.lockstep.internal.normalize.EncodedValue;
import com.questrail.lockstep.internal.normalize.RawFailure;
import com.questrail.lockstep.model.DropProposal;
import com.questrail.lockstep.model.Flush;
import com.questrail.lockstep.model.Freeze;
import com.questrail.lockstep.model.Propose;
import com.questrail.lockstep.model.TokenTransfer;
import com.questrail.lockstep.model.TransferContractTokens;
import com.questrail.lockstep.model.TransferDestination;
import com.questrail.lockstep.model.TransferOwnership;
import com.questrail.lockstep.model.Unfreeze;
import com.questrail.lockstep.model.Vote;
import com.questrail.lockstep.model.VoteParam;
import com.questrail.lockstep.model.CustomCall;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * ToyDaoSystem
 * -----------------------------------------------------------------------------
 * In-memory stand-in for a chain running the toy governance contract.
 *
 * <p>Written independently of {@link ToyDaoModel}: mutable state, dispatch by
 * entrypoint name, failures reported in the raw shapes a real chain produces
 * (bare tag, tag pair, encoded expression). A {@link Flaw} can be injected to
 * make the implementation deliberately wrong.</p>
 */
public final class ToyDaoSystem implements SystemClient<ToyStorage> {

    public enum Flaw {
        NONE,
        /** Votes are counted twice. */
        DOUBLE_COUNTED_VOTES,
        /** A vote rewrites the proposal's proposer to the voter. */
        MISATTRIBUTED_VOTES,
        /** Plain tez transfers are accepted but never credited. */
        DROPPED_DEFAULT_TRANSFER,
        /** Every rejection carries a tag outside the error taxonomy. */
        UNKNOWN_ERROR_TAG
    }

    private final Address self;
    private final Environment environment;
    private final Flaw flaw;

    private long level;
    private Address admin;
    private Address pendingOwner;
    private final TreeMap<Address, Long> frozen = new TreeMap<>();
    private final TreeMap<String, ToyStorage.Proposal> proposals = new TreeMap<>();
    private long balance;

    private final Map<Address, List<Object>> entityStorage = new LinkedHashMap<>();
    private final Map<Address, Long> entityBalance = new LinkedHashMap<>();
    private final Map<Address, Long> accounts = new TreeMap<>();

    private final List<String> journal = new ArrayList<>();
    private int submissions;

    public ToyDaoSystem(Address self, Environment environment, ToyStorage initial, long genesisLevel, Flaw flaw) {
        this.self = Objects.requireNonNull(self, "self");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.flaw = Objects.requireNonNull(flaw, "flaw");
        this.level = genesisLevel;
        this.admin = initial.admin();
        this.pendingOwner = initial.pendingOwner().orElse(null);
        this.frozen.putAll(initial.frozen());
        this.proposals.putAll(initial.proposals());
        for (Address handle : environment.handles().values()) {
            entityStorage.put(handle, new ArrayList<>());
            entityBalance.put(handle, 0L);
        }
    }

    // ---------------------------------------------------------------------
    // SystemClient
    // ---------------------------------------------------------------------

    @Override
    public Address primaryAddress() {
        return self;
    }

    @Override
    public long currentLevel() {
        return level;
    }

    @Override
    public void advanceLevel(long levels) {
        journal.add("advance " + levels);
        level += levels;
    }

    @Override
    public void fund(Address address, Mutez amount) {
        journal.add("fund " + address + " " + amount);
        if (address.equals(self)) {
            balance += amount.value();
        } else if (entityBalance.containsKey(address)) {
            entityBalance.merge(address, amount.value(), Long::sum);
        } else {
            accounts.merge(address, amount.value(), Long::sum);
        }
    }

    @Override
    public Optional<RawFailure> call(Address sender, EntrypointCall call) {
        submissions++;
        journal.add("call " + call.name() + " from " + sender);

        if (!call.amount().isZero() && !call.argument().kind().acceptsTez()) {
            return reject(ErrorCode.FORBIDDEN_XTZ);
        }

        Optional<RawFailure> failure;
        switch (call.name()) {
            case "freeze" -> failure = freeze(sender, (Freeze) call.argument());
            case "unfreeze" -> failure = unfreeze(sender, (Unfreeze) call.argument());
            case "propose" -> failure = propose(sender, (Propose) call.argument());
            case "vote" -> failure = vote(sender, (Vote) call.argument());
            case "flush" -> failure = flush((Flush) call.argument());
            case "drop_proposal" -> failure = drop(sender, (DropProposal) call.argument());
            case "update_delegate", "unstake_vote" -> failure = Optional.empty();
            case "transfer_contract_tokens" -> failure = transferTokens(sender, (TransferContractTokens) call.argument());
            case "transfer_ownership" -> failure = transferOwnership(sender, (TransferOwnership) call.argument());
            case "accept_ownership" -> failure = acceptOwnership(sender);
            case LookupRegistry.NAME -> failure = lookup((CustomCall) call.argument());
            default -> failure = Optional.of(new RawFailure.Unrecognized("no entrypoint " + call.name()));
        }

        if (failure.isEmpty()) {
            balance += call.amount().value();
        }
        return failure;
    }

    @Override
    public Optional<RawFailure> transfer(Address sender, Mutez amount) {
        submissions++;
        journal.add("transfer " + amount + " from " + sender);
        if (flaw != Flaw.DROPPED_DEFAULT_TRANSFER) {
            balance += amount.value();
        }
        return Optional.empty();
    }

    @Override
    public ToyStorage primaryStorage() {
        return new ToyStorage(admin, Optional.ofNullable(pendingOwner), frozen, proposals);
    }

    @Override
    public Mutez primaryBalance() {
        return Mutez.of(balance);
    }

    @Override
    public Optional<EntityState> entityState(Address address) {
        List<Object> storage = entityStorage.get(address);
        if (storage == null) {
            return Optional.empty();
        }
        return Optional.of(new EntityState(storage, Mutez.of(entityBalance.get(address))));
    }

    // ---------------------------------------------------------------------
    // Entrypoints
    // ---------------------------------------------------------------------

    private Optional<RawFailure> freeze(Address sender, Freeze f) {
        frozen.merge(sender, f.amount(), Long::sum);
        if (frozen.get(sender) == 0) {
            frozen.remove(sender);
        }
        record(gov(), new TokenTransfer(sender, List.of(new TransferDestination(self, 0, f.amount()))));
        return Optional.empty();
    }

    private Optional<RawFailure> unfreeze(Address sender, Unfreeze u) {
        long held = frozen.getOrDefault(sender, 0L);
        if (held < u.amount()) {
            return notEnoughFrozen(u.amount());
        }
        if (held == u.amount()) {
            frozen.remove(sender);
        } else {
            frozen.put(sender, held - u.amount());
        }
        record(gov(), new TokenTransfer(self, List.of(new TransferDestination(sender, 0, u.amount()))));
        return Optional.empty();
    }

    private Optional<RawFailure> propose(Address sender, Propose p) {
        if (frozen.getOrDefault(sender, 0L) < p.frozenToken()) {
            return notEnoughFrozen(p.frozenToken());
        }
        String key = String.valueOf(p.metadata());
        if (proposals.containsKey(key)) {
            return reject(ErrorCode.PROPOSAL_NOT_UNIQUE);
        }
        proposals.put(key, new ToyStorage.Proposal(sender, 0, 0, level));
        return Optional.empty();
    }

    private Optional<RawFailure> vote(Address sender, Vote v) {
        long held = frozen.getOrDefault(sender, 0L);
        for (VoteParam param : v.votes()) {
            if (!proposals.containsKey(param.proposalKey().value())) {
                return proposalMissing(param.proposalKey().value());
            }
            if (held < param.voteAmount()) {
                return notEnoughFrozen(param.voteAmount());
            }
        }
        long weight = flaw == Flaw.DOUBLE_COUNTED_VOTES ? 2 : 1;
        for (VoteParam param : v.votes()) {
            String key = param.proposalKey().value();
            ToyStorage.Proposal p = proposals.get(key);
            long amount = weight * param.voteAmount();
            Address proposer = flaw == Flaw.MISATTRIBUTED_VOTES ? sender : p.proposer();
            proposals.put(key, param.upvote()
                    ? new ToyStorage.Proposal(proposer, p.upvotes() + amount, p.downvotes(), p.startLevel())
                    : new ToyStorage.Proposal(proposer, p.upvotes(), p.downvotes() + amount, p.startLevel()));
        }
        return Optional.empty();
    }

    private Optional<RawFailure> flush(Flush f) {
        if (f.count() == 0 || proposals.isEmpty()) {
            return reject(ErrorCode.EMPTY_FLUSH);
        }
        Iterator<String> keys = proposals.keySet().iterator();
        for (int i = 0; i < f.count() && keys.hasNext(); i++) {
            keys.next();
            keys.remove();
        }
        return Optional.empty();
    }

    private Optional<RawFailure> drop(Address sender, DropProposal d) {
        ToyStorage.Proposal p = proposals.get(d.proposalKey().value());
        if (p == null) {
            return proposalMissing(d.proposalKey().value());
        }
        if (!sender.equals(p.proposer()) && !sender.equals(environment.require(EntityRole.GUARDIAN))) {
            return reject(ErrorCode.DROP_PROPOSAL_CONDITION_NOT_MET);
        }
        proposals.remove(d.proposalKey().value());
        return Optional.empty();
    }

    private Optional<RawFailure> transferTokens(Address sender, TransferContractTokens t) {
        if (!sender.equals(admin)) {
            return reject(ErrorCode.NOT_ADMIN);
        }
        if (!entityStorage.containsKey(t.contractAddress())) {
            return Optional.of(new RawFailure.Unrecognized("no contract at " + t.contractAddress()));
        }
        for (TokenTransfer transfer : t.transfers()) {
            record(t.contractAddress(), transfer);
        }
        return Optional.empty();
    }

    private Optional<RawFailure> transferOwnership(Address sender, TransferOwnership t) {
        if (!sender.equals(admin)) {
            return reject(ErrorCode.NOT_ADMIN);
        }
        pendingOwner = t.newOwner();
        return Optional.empty();
    }

    private Optional<RawFailure> acceptOwnership(Address sender) {
        if (pendingOwner == null || !pendingOwner.equals(sender)) {
            return reject(ErrorCode.NOT_PENDING_ADMIN);
        }
        admin = sender;
        pendingOwner = null;
        return Optional.empty();
    }

    private Optional<RawFailure> lookup(CustomCall call) {
        LookupRegistry lookup = (LookupRegistry) call.payload();
        record(environment.require(EntityRole.VIEW_CONSUMER), lookup.key());
        return Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Failure encodings
    // ---------------------------------------------------------------------

    private Optional<RawFailure> reject(ErrorCode error) {
        if (flaw == Flaw.UNKNOWN_ERROR_TAG) {
            return Optional.of(RawFailure.numeric(999));
        }
        return Optional.of(RawFailure.numeric(error.code().longValueExact()));
    }

    private Optional<RawFailure> notEnoughFrozen(long required) {
        if (flaw == Flaw.UNKNOWN_ERROR_TAG) {
            return reject(ErrorCode.NOT_ENOUGH_FROZEN_TOKENS);
        }
        return Optional.of(RawFailure.pair(
                RawFailure.numeric(ErrorCode.NOT_ENOUGH_FROZEN_TOKENS.code().longValueExact()),
                RawFailure.numeric(required)));
    }

    private Optional<RawFailure> proposalMissing(String key) {
        if (flaw == Flaw.UNKNOWN_ERROR_TAG) {
            return reject(ErrorCode.PROPOSAL_NOT_EXIST);
        }
        return Optional.of(RawFailure.encoded(EncodedValue.pair(
                EncodedValue.integer(ErrorCode.PROPOSAL_NOT_EXIST.code().longValueExact()),
                EncodedValue.string(key))));
    }

    private void record(Address entity, Object value) {
        entityStorage.get(entity).add(value);
    }

    private Address gov() {
        return environment.require(EntityRole.GOVERNANCE_TOKEN);
    }

    // ---------------------------------------------------------------------
    // Test accessors
    // ---------------------------------------------------------------------

    /** Calls and transfers submitted so far. */
    public int submissions() {
        return submissions;
    }

    public List<String> journal() {
        return List.copyOf(journal);
    }

    public long accountBalance(Address account) {
        return accounts.getOrDefault(account, 0L);
    }
}
