package com.swiftload.loadservice.service;

import com.swiftload.loadservice.dto.BidResponse;
import com.swiftload.loadservice.model.Bid;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.security.Actor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Bid ledger. Mutations expect the caller to hold the lock on the bid's load
 * (see {@link AssignmentService}).
 */
public interface BidService {

    /**
     * Resolves the load a bid belongs to without loading the bid itself.
     *
     * @throws com.swiftload.common.exception.ResourceNotFoundException if the bid does not exist
     */
    UUID findLoadIdOfBid(UUID bidId);

    Bid findBid(UUID bidId);

    /**
     * Creates a PENDING bid on an OPEN load. A PENDING bid the trucker already
     * holds on the same load is WITHDRAWN first.
     */
    BidPlacement place(Load load, UUID truckerId, BigDecimal amount, String message);

    /**
     * PENDING -> WITHDRAWN. Only the bidding trucker or an admin.
     */
    Bid withdraw(Bid bid, Actor actor);

    /**
     * PENDING -> ACCEPTED.
     */
    Bid accept(Bid bid);

    /**
     * PENDING -> REJECTED.
     */
    Bid reject(Bid bid);

    /**
     * Rejects every PENDING bid on the load except the accepted one.
     *
     * @return ids of the bids that were rejected
     */
    List<UUID> rejectOthers(UUID loadId, UUID acceptedBidId);

    /**
     * Rejects every PENDING bid on the load. Used when the load is cancelled.
     */
    List<UUID> rejectPending(UUID loadId);

    /**
     * @return true if the trucker holds a PENDING or ACCEPTED bid on the load
     */
    boolean hasActiveBid(UUID loadId, UUID truckerId);

    /**
     * Bids on a load, cheapest then earliest first. The owner and admins see all
     * of them, a trucker sees only their own.
     */
    List<BidResponse> listForLoad(UUID loadId, Actor actor);

    List<BidResponse> listMine(Actor actor);
}
