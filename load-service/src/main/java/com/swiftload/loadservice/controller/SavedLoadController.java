package com.swiftload.loadservice.controller;

import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.SavedLoadToggleResponse;
import com.swiftload.loadservice.security.ActorResolver;
import com.swiftload.loadservice.service.SavedLoadService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/saved-loads")
@RequiredArgsConstructor
public class SavedLoadController {

    private final SavedLoadService savedLoadService;
    private final ActorResolver actorResolver;

    @PostMapping("/{loadId}/toggle")
    public ResponseEntity<SavedLoadToggleResponse> toggle(
            @PathVariable UUID loadId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(savedLoadService.toggle(loadId, actorResolver.resolve(jwt)));
    }

    @GetMapping
    public ResponseEntity<List<LoadResponse>> getSavedLoads(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(savedLoadService.listSaved(actorResolver.resolve(jwt)));
    }
}
