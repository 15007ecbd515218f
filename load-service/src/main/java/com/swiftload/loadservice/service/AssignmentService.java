package com.swiftload.loadservice.service;

import com.swiftload.loadservice.dto.BidRequest;
import com.swiftload.loadservice.dto.BidResponse;
import com.swiftload.loadservice.dto.LoadRequest;
import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.LoadTermsRequest;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.security.Actor;

import java.util.UUID;

/**
 * The single entry point for every state-changing action on loads and bids.
 *
 * <p>Each operation runs in one transaction and takes a pessimistic write lock on
 * the load row before checking its status, so concurrent accepts or an accept
 * racing a cancel are serialized: the loser re-reads a non-OPEN load and fails
 * with {@link com.swiftload.loadservice.exception.InvalidLoadStateException}.
 *
 * <p>Guards are evaluated in this order: terminal state, then the caller's stake
 * in the load ({@link LoadTransition}), then the adjacency table
 * ({@link LoadStateMachine}). Admins pass the stake check but never the table.
 */
public interface AssignmentService {

    /**
     * Posts a new OPEN load owned by the caller.
     *
     * @param actor   shipper (or admin) posting the load
     * @param request load terms
     * @return the created load
     * @throws com.swiftload.common.exception.AccessDeniedException if the caller is a trucker
     * @throws com.swiftload.common.exception.ValidationException   if the terms are malformed
     */
    LoadResponse postLoad(Actor actor, LoadRequest request);

    /**
     * Changes the terms of an OPEN load.
     *
     * @throws com.swiftload.common.exception.AccessDeniedException if the caller is not the owner or an admin
     * @throws com.swiftload.loadservice.exception.InvalidLoadStateException if the load is not OPEN
     */
    LoadResponse updateLoadTerms(UUID loadId, Actor actor, LoadTermsRequest request);

    /**
     * OPEN or ASSIGNED -> CANCELLED. Clears the assignment and rejects any bids
     * still pending.
     */
    LoadResponse cancelLoad(UUID loadId, Actor actor);

    /**
     * Places a bid on an OPEN load, withdrawing the trucker's earlier PENDING bid
     * on it if there is one.
     *
     * @throws com.swiftload.common.exception.AccessDeniedException if the caller is not a trucker
     */
    BidResponse placeBid(UUID loadId, Actor actor, BidRequest request);

    BidResponse withdrawBid(UUID bidId, Actor actor);

    /**
     * Accepts one bid and assigns its trucker. Load ASSIGNED, trucker recorded,
     * bid ACCEPTED and every sibling PENDING bid REJECTED, all in one transaction.
     * Calling it again after success fails with InvalidLoadStateException.
     *
     * @throws com.swiftload.common.exception.ResourceNotFoundException if the bid does not belong to the load
     */
    LoadResponse acceptBid(UUID loadId, UUID bidId, Actor actor);

    /**
     * Explicitly rejects one PENDING bid. Owner or admin, load must be OPEN.
     */
    BidResponse rejectBid(UUID bidId, Actor actor);

    /**
     * ASSIGNED -> IN_TRANSIT, by the assigned trucker.
     */
    LoadResponse advanceToInTransit(UUID loadId, Actor actor);

    /**
     * IN_TRANSIT -> COMPLETED, by the assigned trucker or the owner.
     */
    LoadResponse markComplete(UUID loadId, Actor actor);

    /**
     * A party is the owner, the assigned trucker, or a trucker holding a PENDING
     * or ACCEPTED bid on the load.
     */
    boolean isParty(Load load, UUID userId);
}
