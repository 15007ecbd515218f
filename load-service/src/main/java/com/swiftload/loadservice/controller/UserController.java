package com.swiftload.loadservice.controller;

import com.swiftload.loadservice.dto.UserProfileResponse;
import com.swiftload.loadservice.security.ActorResolver;
import com.swiftload.loadservice.service.UserAccountService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserAccountService userAccountService;
    private final ActorResolver actorResolver;

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> getMyProfile(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(userAccountService.getOrCreateProfile(jwt, actorResolver.resolve(jwt)));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> getProfile(
            @PathVariable UUID userId,
            @AuthenticationPrincipal Jwt jwt) {
        actorResolver.resolve(jwt);
        return ResponseEntity.ok(userAccountService.getProfile(userId));
    }
}
