package com.swiftload.loadservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class BidRequest {

    @NotNull(message = "Bid amount cannot be null")
    @DecimalMin(value = "0.01", message = "Bid amount must be greater than zero")
    private BigDecimal amount;

    @Size(max = 1000, message = "Message must be at most 1000 characters")
    private String message;
}
