package com.swiftload.loadservice.dto;

import com.swiftload.loadservice.model.LoadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Board filters. Text filters are case-insensitive substring matches; every
 * filter is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadSearchCriteria {
    private String pickupCity;
    private String deliveryCity;
    private String equipment;
    private BigDecimal minRate;
    private Double maxWeight;
    private LoadStatus status;
}
