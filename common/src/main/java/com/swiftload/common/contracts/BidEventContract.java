package com.swiftload.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for bid.placed, bid.withdrawn and bid.rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BidEventContract {
    private UUID bidId;
    private UUID loadId;
    private UUID truckerId;
    private UUID shipperId;
    private BigDecimal amount;
    private String status;
    private UUID supersededBidId; // set when placing a bid withdrew an earlier one
    private Instant occurredAt;
}
