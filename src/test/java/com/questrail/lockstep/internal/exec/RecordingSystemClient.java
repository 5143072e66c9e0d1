package com.questrail.lockstep.internal.exec;

import com.questrail.lockstep.api.Address;
import com.questrail.lockstep.api.EntityState;
import com.questrail.lockstep.api.Mutez;
import com.questrail.lockstep.internal.normalize.RawFailure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RecordingSystemClient
 * ---------------------
 *
 * Test double that records every interaction in order and answers submissions
 * from a script of canned responses (success when the script is empty).
 */
public final class RecordingSystemClient implements SystemClient<String> {

    public static final Address SELF = Address.of("KT1self");

    private final List<String> actions = new ArrayList<>();
    private final Deque<Optional<RawFailure>> responses = new ArrayDeque<>();
    private final Map<Address, EntityState> entities = new LinkedHashMap<>();

    private long level;
    private String storage = "initial";
    private Mutez balance = Mutez.ZERO;

    public RecordingSystemClient withEntity(Address handle, EntityState state) {
        entities.put(handle, state);
        return this;
    }

    public RecordingSystemClient respondWith(RawFailure failure) {
        responses.addLast(Optional.of(failure));
        return this;
    }

    public RecordingSystemClient respondWithSuccess() {
        responses.addLast(Optional.empty());
        return this;
    }

    public void setStorage(String storage) {
        this.storage = storage;
    }

    public void setBalance(Mutez balance) {
        this.balance = balance;
    }

    @Override
    public Address primaryAddress() {
        return SELF;
    }

    @Override
    public long currentLevel() {
        return level;
    }

    @Override
    public void advanceLevel(long levels) {
        actions.add("advance " + levels);
        level += levels;
    }

    @Override
    public void fund(Address address, Mutez amount) {
        actions.add("fund " + address + " " + amount.value());
    }

    @Override
    public Optional<RawFailure> call(Address sender, EntrypointCall call) {
        actions.add("call " + call.name() + " from " + sender + " with " + call.amount().value());
        return next();
    }

    @Override
    public Optional<RawFailure> transfer(Address sender, Mutez amount) {
        actions.add("transfer " + amount.value() + " from " + sender);
        return next();
    }

    @Override
    public String primaryStorage() {
        actions.add("read storage");
        return storage;
    }

    @Override
    public Mutez primaryBalance() {
        actions.add("read balance");
        return balance;
    }

    @Override
    public Optional<EntityState> entityState(Address address) {
        actions.add("read entity " + address);
        return Optional.ofNullable(entities.get(address));
    }

    private Optional<RawFailure> next() {
        Optional<RawFailure> response = responses.pollFirst();
        return response == null ? Optional.empty() : response;
    }

    public List<String> actions() {
        return List.copyOf(actions);
    }
}
