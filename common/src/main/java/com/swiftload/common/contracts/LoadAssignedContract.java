package com.swiftload.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once per load when a shipper (or admin) accepts a bid.
 * Carries the losing bids so their truckers can be told the load is gone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadAssignedContract {
    private UUID loadId;
    private UUID shipperId;
    private UUID truckerId;
    private UUID acceptedBidId;
    private BigDecimal amount;
    private List<UUID> rejectedBidIds;
    private UUID acceptedBy;
    private Instant occurredAt;
}
