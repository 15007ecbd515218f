package com.swiftload.loadservice.controller;

import com.swiftload.loadservice.dto.AdminStatsResponse;
import com.swiftload.loadservice.security.ActorResolver;
import com.swiftload.loadservice.service.AdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminService adminService;
    private final ActorResolver actorResolver;

    @GetMapping("/stats")
    public ResponseEntity<AdminStatsResponse> getStats(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(adminService.getStats(actorResolver.resolve(jwt)));
    }
}
