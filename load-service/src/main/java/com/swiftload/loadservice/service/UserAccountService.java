package com.swiftload.loadservice.service;

import com.swiftload.loadservice.dto.UserProfileResponse;
import com.swiftload.loadservice.security.Actor;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.UUID;

public interface UserAccountService {

    /**
     * Returns the caller's profile, creating it from the token claims on the
     * first call and refreshing the contact details on later ones.
     */
    UserProfileResponse getOrCreateProfile(Jwt jwt, Actor actor);

    UserProfileResponse getProfile(UUID userId);
}
