package com.swiftload.loadservice.model;

public enum LoadStatus {
    OPEN,
    ASSIGNED,
    IN_TRANSIT,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    // assignedTruckerId must be set exactly in these states
    public boolean requiresAssignedTrucker() {
        return this == ASSIGNED || this == IN_TRANSIT || this == COMPLETED;
    }
}
