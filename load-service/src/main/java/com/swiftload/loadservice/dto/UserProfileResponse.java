package com.swiftload.loadservice.dto;

import com.swiftload.loadservice.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileResponse {
    private UUID id;
    private UserRole role;
    private String name;
    private String email;
    private String company;
    private String phone;
    private String mcNumber;
    private Instant createdAt;
}
