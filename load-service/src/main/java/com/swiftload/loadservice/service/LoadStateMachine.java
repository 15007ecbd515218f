package com.swiftload.loadservice.service;

import com.swiftload.loadservice.exception.InvalidLoadStateException;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.model.LoadStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency table of the load lifecycle.
 *
 * <pre>
 * OPEN       -> ASSIGNED, CANCELLED
 * ASSIGNED   -> IN_TRANSIT, CANCELLED
 * IN_TRANSIT -> COMPLETED
 * COMPLETED, CANCELLED: terminal
 * </pre>
 *
 * No role bypasses this table, admins included.
 */
public final class LoadStateMachine {

    private static final Map<LoadStatus, Set<LoadStatus>> ALLOWED = new EnumMap<>(LoadStatus.class);

    static {
        ALLOWED.put(LoadStatus.OPEN, EnumSet.of(LoadStatus.ASSIGNED, LoadStatus.CANCELLED));
        ALLOWED.put(LoadStatus.ASSIGNED, EnumSet.of(LoadStatus.IN_TRANSIT, LoadStatus.CANCELLED));
        ALLOWED.put(LoadStatus.IN_TRANSIT, EnumSet.of(LoadStatus.COMPLETED));
        ALLOWED.put(LoadStatus.COMPLETED, EnumSet.noneOf(LoadStatus.class));
        ALLOWED.put(LoadStatus.CANCELLED, EnumSet.noneOf(LoadStatus.class));
    }

    private LoadStateMachine() {
    }

    public static boolean canTransition(LoadStatus from, LoadStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    public static Set<LoadStatus> nextStates(LoadStatus from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    public static void requireTransition(Load load, LoadStatus target) {
        LoadStatus current = load.getStatus();
        if (current.isTerminal()) {
            throw new InvalidLoadStateException(
                    "Load is " + current + " and accepts no further transitions.");
        }
        if (!canTransition(current, target)) {
            throw new InvalidLoadStateException(
                    "Load cannot move from " + current + " to " + target + ". Allowed: " + nextStates(current));
        }
    }
}
