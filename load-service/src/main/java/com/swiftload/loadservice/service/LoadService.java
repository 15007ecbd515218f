package com.swiftload.loadservice.service;

import com.swiftload.loadservice.dto.DashboardResponse;
import com.swiftload.loadservice.dto.LoadRequest;
import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.LoadSearchCriteria;
import com.swiftload.loadservice.dto.LoadTermsRequest;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.model.LoadStatus;
import com.swiftload.loadservice.security.Actor;

import java.util.List;
import java.util.UUID;

/**
 * Owns load records. Status writes are reserved for {@link AssignmentService}.
 */
public interface LoadService {

    /**
     * Validates the terms and stores a new OPEN load owned by {@code ownerId}.
     */
    Load create(UUID ownerId, LoadRequest request);

    Load findLoad(UUID loadId);

    /**
     * Loads and row-locks a load for the rest of the current transaction.
     */
    Load findLoadForUpdate(UUID loadId);

    /**
     * Applies new terms. Owner (or admin) only, OPEN only.
     */
    Load updateTerms(Load load, Actor actor, LoadTermsRequest request);

    /**
     * Moves a load to {@code target} if the adjacency table allows it.
     * Leaving an assignment (cancel) clears the assigned trucker.
     */
    Load setStatus(Load load, LoadStatus target);

    /**
     * OPEN -> ASSIGNED, recording the trucker.
     */
    Load assignTrucker(Load load, UUID truckerId);

    LoadResponse getLoad(UUID loadId);

    List<LoadResponse> searchLoads(LoadSearchCriteria criteria);

    DashboardResponse getDashboard(Actor actor);
}
