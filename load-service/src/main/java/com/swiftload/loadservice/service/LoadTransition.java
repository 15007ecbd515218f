package com.swiftload.loadservice.service;

import com.swiftload.loadservice.model.LoadStatus;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Guard table for the events that change a load's status: the target state and
 * the parties allowed to trigger it. Admins pass every party guard; the source
 * state is checked against {@link LoadStateMachine}.
 */
public enum LoadTransition {

    ACCEPT_BID("accept a bid on", LoadStatus.ASSIGNED, EnumSet.of(LoadParty.OWNER)),
    CANCEL("cancel", LoadStatus.CANCELLED, EnumSet.of(LoadParty.OWNER)),
    MARK_IN_TRANSIT("mark in transit", LoadStatus.IN_TRANSIT, EnumSet.of(LoadParty.ASSIGNED_TRUCKER)),
    COMPLETE("complete", LoadStatus.COMPLETED, EnumSet.of(LoadParty.OWNER, LoadParty.ASSIGNED_TRUCKER));

    private final String action;
    private final LoadStatus target;
    private final Set<LoadParty> permittedParties;

    LoadTransition(String action, LoadStatus target, EnumSet<LoadParty> permittedParties) {
        this.action = action;
        this.target = target;
        this.permittedParties = Collections.unmodifiableSet(permittedParties);
    }

    public String getAction() {
        return action;
    }

    public LoadStatus getTarget() {
        return target;
    }

    public Set<LoadParty> getPermittedParties() {
        return permittedParties;
    }

    public boolean permits(Set<LoadParty> parties) {
        return parties.stream().anyMatch(permittedParties::contains);
    }
}
