package com.swiftload.loadservice.service;

import com.swiftload.loadservice.dto.MessageRequest;
import com.swiftload.loadservice.dto.MessageResponse;
import com.swiftload.loadservice.security.Actor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.UUID;

public interface MessageService {

    /**
     * Sends a message about a load. Sender and recipient must both be parties to
     * the load unless one of them is an admin.
     *
     * @throws com.swiftload.common.exception.ValidationException       blank or oversized body, or a message to oneself
     * @throws com.swiftload.common.exception.ResourceNotFoundException unknown load or recipient
     * @throws com.swiftload.common.exception.AccessDeniedException     either side is not a party
     */
    MessageResponse sendMessage(UUID loadId, Actor sender, MessageRequest request);

    /**
     * One page of a load's conversation, oldest first. Admins see the whole
     * thread, other parties the messages they sent or received.
     */
    Page<MessageResponse> getThread(UUID loadId, Actor actor, Pageable pageable);

    /**
     * Messages received by the caller across all loads, newest first.
     */
    Page<MessageResponse> getInbox(Actor actor, Pageable pageable);
}
