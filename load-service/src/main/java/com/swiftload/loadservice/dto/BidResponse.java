package com.swiftload.loadservice.dto;

import com.swiftload.loadservice.model.BidStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BidResponse {
    private UUID id;
    private UUID loadId;
    private UUID truckerId;
    private BigDecimal amount;
    private String message;
    private BidStatus status;
    private Instant createdAt;
}
