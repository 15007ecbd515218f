package com.swiftload.loadservice.service;

import com.swiftload.loadservice.model.Bid;
import lombok.Value;

import java.util.UUID;

/**
 * Result of placing a bid: the new PENDING bid and, when the trucker already had
 * one on the load, the id of the bid it replaced.
 */
@Value
public class BidPlacement {

    Bid bid;

    UUID supersededBidId;

    public boolean hasSuperseded() {
        return supersededBidId != null;
    }
}
