package com.swiftload.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published whenever a load is posted, edited or moves through its lifecycle
 * (load.posted, load.updated, load.in_transit, load.completed, load.cancelled).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadStatusChangeContract {
    private UUID loadId;
    private UUID shipperId;
    private UUID assignedTruckerId; // nullable
    private String oldStatus; // null for load.posted
    private String status;
    private BigDecimal rate;
    private String pickupCity;
    private String deliveryCity;
    private UUID changedBy;
    private Instant occurredAt;
}
