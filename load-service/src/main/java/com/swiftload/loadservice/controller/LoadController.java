package com.swiftload.loadservice.controller;

import com.swiftload.loadservice.dto.DashboardResponse;
import com.swiftload.loadservice.dto.LoadRequest;
import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.LoadSearchCriteria;
import com.swiftload.loadservice.dto.LoadTermsRequest;
import com.swiftload.loadservice.security.ActorResolver;
import com.swiftload.loadservice.service.AssignmentService;
import com.swiftload.loadservice.service.LoadService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/loads")
@RequiredArgsConstructor
public class LoadController {

    private final AssignmentService assignmentService;
    private final LoadService loadService;
    private final ActorResolver actorResolver;

    @PostMapping
    public ResponseEntity<LoadResponse> postLoad(
            @Valid @RequestBody LoadRequest loadRequest,
            @AuthenticationPrincipal Jwt jwt) {
        LoadResponse response = assignmentService.postLoad(actorResolver.resolve(jwt), loadRequest);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<LoadResponse>> searchLoads(
            @ModelAttribute LoadSearchCriteria criteria,
            @AuthenticationPrincipal Jwt jwt) {
        actorResolver.resolve(jwt);
        return ResponseEntity.ok(loadService.searchLoads(criteria));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardResponse> getDashboard(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(loadService.getDashboard(actorResolver.resolve(jwt)));
    }

    @GetMapping("/{loadId}")
    public ResponseEntity<LoadResponse> getLoad(
            @PathVariable UUID loadId,
            @AuthenticationPrincipal Jwt jwt) {
        actorResolver.resolve(jwt);
        return ResponseEntity.ok(loadService.getLoad(loadId));
    }

    @PatchMapping("/{loadId}")
    public ResponseEntity<LoadResponse> updateLoadTerms(
            @PathVariable UUID loadId,
            @Valid @RequestBody LoadTermsRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        LoadResponse response = assignmentService.updateLoadTerms(loadId, actorResolver.resolve(jwt), request);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{loadId}/cancel")
    public ResponseEntity<LoadResponse> cancelLoad(
            @PathVariable UUID loadId,
            @AuthenticationPrincipal Jwt jwt) {
        LoadResponse response = assignmentService.cancelLoad(loadId, actorResolver.resolve(jwt));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{loadId}/in-transit")
    public ResponseEntity<LoadResponse> advanceToInTransit(
            @PathVariable UUID loadId,
            @AuthenticationPrincipal Jwt jwt) {
        LoadResponse response = assignmentService.advanceToInTransit(loadId, actorResolver.resolve(jwt));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{loadId}/complete")
    public ResponseEntity<LoadResponse> markComplete(
            @PathVariable UUID loadId,
            @AuthenticationPrincipal Jwt jwt) {
        LoadResponse response = assignmentService.markComplete(loadId, actorResolver.resolve(jwt));
        return ResponseEntity.ok(response);
    }
}
