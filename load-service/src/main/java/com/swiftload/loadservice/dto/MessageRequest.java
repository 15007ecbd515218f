package com.swiftload.loadservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.UUID;

@Data
public class MessageRequest {

    @NotNull(message = "Recipient ID cannot be null")
    private UUID recipientId;

    @NotBlank(message = "Message body cannot be blank")
    @Size(max = 2000, message = "Message body must be at most 2000 characters")
    private String body;
}
