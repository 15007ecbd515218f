package com.swiftload.loadservice.service;

import com.swiftload.loadservice.model.Load;

import java.util.EnumSet;
import java.util.UUID;

/**
 * The stake a user holds in a particular load.
 */
public enum LoadParty {
    OWNER,
    ASSIGNED_TRUCKER;

    public static EnumSet<LoadParty> of(Load load, UUID userId) {
        EnumSet<LoadParty> parties = EnumSet.noneOf(LoadParty.class);
        if (load.getShipperId().equals(userId)) {
            parties.add(OWNER);
        }
        if (userId.equals(load.getAssignedTruckerId())) {
            parties.add(ASSIGNED_TRUCKER);
        }
        return parties;
    }
}
