package com.swiftload.loadservice.controller;

import com.swiftload.loadservice.dto.BidRequest;
import com.swiftload.loadservice.dto.BidResponse;
import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.security.ActorResolver;
import com.swiftload.loadservice.service.AssignmentService;
import com.swiftload.loadservice.service.BidService;
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
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BidController {

    private final AssignmentService assignmentService;
    private final BidService bidService;
    private final ActorResolver actorResolver;

    @PostMapping("/loads/{loadId}/bids")
    public ResponseEntity<BidResponse> placeBid(
            @PathVariable UUID loadId,
            @Valid @RequestBody BidRequest bidRequest,
            @AuthenticationPrincipal Jwt jwt) {
        BidResponse response = assignmentService.placeBid(loadId, actorResolver.resolve(jwt), bidRequest);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/loads/{loadId}/bids")
    public ResponseEntity<List<BidResponse>> getBidsForLoad(
            @PathVariable UUID loadId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(bidService.listForLoad(loadId, actorResolver.resolve(jwt)));
    }

    @PostMapping("/loads/{loadId}/bids/{bidId}/accept")
    public ResponseEntity<LoadResponse> acceptBid(
            @PathVariable UUID loadId,
            @PathVariable UUID bidId,
            @AuthenticationPrincipal Jwt jwt) {
        LoadResponse response = assignmentService.acceptBid(loadId, bidId, actorResolver.resolve(jwt));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/bids/mine")
    public ResponseEntity<List<BidResponse>> getMyBids(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(bidService.listMine(actorResolver.resolve(jwt)));
    }

    @PostMapping("/bids/{bidId}/withdraw")
    public ResponseEntity<BidResponse> withdrawBid(
            @PathVariable UUID bidId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(assignmentService.withdrawBid(bidId, actorResolver.resolve(jwt)));
    }

    @PostMapping("/bids/{bidId}/reject")
    public ResponseEntity<BidResponse> rejectBid(
            @PathVariable UUID bidId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(assignmentService.rejectBid(bidId, actorResolver.resolve(jwt)));
    }
}
