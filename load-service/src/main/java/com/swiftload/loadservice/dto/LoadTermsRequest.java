package com.swiftload.loadservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of an OPEN load's terms. Null fields are left unchanged.
 */
@Data
public class LoadTermsRequest {

    @Size(max = 255, message = "Title must be at most 255 characters")
    private String title;

    private String pickupCity;

    private String pickupState;

    private LocalDate pickupDate;

    private String deliveryCity;

    private String deliveryState;

    private LocalDate deliveryDate;

    @PositiveOrZero(message = "Weight cannot be negative")
    private Double weightLbs;

    private String equipment;

    @DecimalMin(value = "0.01", message = "Rate must be greater than zero")
    private BigDecimal rate;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
}
