package com.swiftload.loadservice.security;

import com.swiftload.loadservice.model.UserRole;
import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

/**
 * Authenticated identity and role of the caller, as supplied by the token.
 * Trusted as-is by the service layer.
 */
@Value
public class Actor {

    @NonNull
    UUID userId;

    @NonNull
    UserRole role;

    public static Actor of(UUID userId, UserRole role) {
        return new Actor(userId, role);
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean hasRole(UserRole expected) {
        return role == expected;
    }
}
