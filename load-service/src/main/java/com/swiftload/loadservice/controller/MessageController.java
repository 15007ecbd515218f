package com.swiftload.loadservice.controller;

import com.swiftload.loadservice.dto.MessageRequest;
import com.swiftload.loadservice.dto.MessageResponse;
import com.swiftload.loadservice.security.ActorResolver;
import com.swiftload.loadservice.service.MessageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MessageController {

    private static final int MAX_PAGE_SIZE = 100;

    private final MessageService messageService;
    private final ActorResolver actorResolver;

    @PostMapping("/loads/{loadId}/messages")
    public ResponseEntity<MessageResponse> sendMessage(
            @PathVariable UUID loadId,
            @Valid @RequestBody MessageRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        MessageResponse response = messageService.sendMessage(loadId, actorResolver.resolve(jwt), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/loads/{loadId}/messages")
    public ResponseEntity<Page<MessageResponse>> getThread(
            @PathVariable UUID loadId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size,
            @AuthenticationPrincipal Jwt jwt) {
        Page<MessageResponse> thread = messageService.getThread(loadId, actorResolver.resolve(jwt), pageOf(page, size));
        return ResponseEntity.ok(thread);
    }

    @GetMapping("/messages/inbox")
    public ResponseEntity<Page<MessageResponse>> getInbox(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(messageService.getInbox(actorResolver.resolve(jwt), pageOf(page, size)));
    }

    private static PageRequest pageOf(int page, int size) {
        return PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
    }
}
