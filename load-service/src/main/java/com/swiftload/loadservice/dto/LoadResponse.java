package com.swiftload.loadservice.dto;

import com.swiftload.loadservice.model.LoadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadResponse {
    private UUID id;
    private UUID shipperId;
    private String title;
    private String pickupCity;
    private String pickupState;
    private LocalDate pickupDate;
    private String deliveryCity;
    private String deliveryState;
    private LocalDate deliveryDate;
    private Double weightLbs;
    private String equipment;
    private BigDecimal rate;
    private String notes;
    private LoadStatus status;
    private UUID assignedTruckerId;
    private Instant createdAt;
    private Instant updatedAt;
}
