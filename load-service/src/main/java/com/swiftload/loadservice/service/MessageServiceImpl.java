package com.swiftload.loadservice.service;

import com.swiftload.common.exception.AccessDeniedException;
import com.swiftload.common.exception.ResourceNotFoundException;
import com.swiftload.common.exception.ValidationException;
import com.swiftload.loadservice.dto.MessageRequest;
import com.swiftload.loadservice.dto.MessageResponse;
import com.swiftload.loadservice.mapper.MessageMapper;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.model.Message;
import com.swiftload.loadservice.model.UserAccount;
import com.swiftload.loadservice.model.UserRole;
import com.swiftload.loadservice.repository.MessageRepository;
import com.swiftload.loadservice.repository.UserAccountRepository;
import com.swiftload.loadservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class MessageServiceImpl implements MessageService {

    static final int MAX_BODY_LENGTH = 2000;

    private final MessageRepository messageRepository;
    private final UserAccountRepository userAccountRepository;
    private final LoadService loadService;
    private final AssignmentService assignmentService;
    private final MessageMapper messageMapper;

    @Override
    @Transactional
    public MessageResponse sendMessage(UUID loadId, Actor sender, MessageRequest request) {
        String body = request.getBody();
        if (body == null || body.isBlank()) {
            throw new ValidationException("body", "Message body cannot be blank");
        }
        if (body.length() > MAX_BODY_LENGTH) {
            throw new ValidationException("body", "Message body must be at most " + MAX_BODY_LENGTH + " characters");
        }
        if (request.getRecipientId() == null) {
            throw new ValidationException("recipientId", "Recipient ID cannot be null");
        }
        if (request.getRecipientId().equals(sender.getUserId())) {
            throw new ValidationException("recipientId", "You cannot send a message to yourself");
        }

        Load load = loadService.findLoad(loadId);
        boolean senderIsParty = sender.isAdmin() || assignmentService.isParty(load, sender.getUserId());
        Optional<UserAccount> recipientAccount = userAccountRepository.findById(request.getRecipientId());

        // a non-party may only reach an admin; an unknown recipient does not change that
        if (!senderIsParty && recipientAccount.map(account -> account.getRole() != UserRole.ADMIN).orElse(true)) {
            log.warn("Access denied: User {} attempted to message about load {} without being a party",
                    sender.getUserId(), loadId);
            throw new AccessDeniedException("Access Denied: You are not a party to this load");
        }

        UserAccount recipient = recipientAccount.orElseThrow(() -> {
            log.warn("Recipient not found: recipientId={}, loadId={}", request.getRecipientId(), loadId);
            return new ResourceNotFoundException("User not found with id: " + request.getRecipientId());
        });

        boolean adminInvolved = sender.isAdmin() || recipient.getRole() == UserRole.ADMIN;
        if (!adminInvolved && !assignmentService.isParty(load, recipient.getId())) {
            log.warn("Access denied: User {} attempted to message non-party {} about load {}",
                    sender.getUserId(), recipient.getId(), loadId);
            throw new AccessDeniedException("Access Denied: The recipient is not a party to this load");
        }

        Message message = Message.builder()
                .loadId(loadId)
                .senderId(sender.getUserId())
                .recipientId(recipient.getId())
                .body(body.trim())
                .build();

        Message saved = messageRepository.save(message);
        log.info("Message sent: messageId={}, loadId={}, from={}, to={}",
                saved.getId(), loadId, sender.getUserId(), recipient.getId());
        return messageMapper.toMessageResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<MessageResponse> getThread(UUID loadId, Actor actor, Pageable pageable) {
        Load load = loadService.findLoad(loadId);

        if (actor.isAdmin()) {
            return messageRepository.findByLoadIdOrderByCreatedAtAscIdAsc(loadId, pageable)
                    .map(messageMapper::toMessageResponse);
        }

        if (!assignmentService.isParty(load, actor.getUserId())) {
            log.warn("Access denied: User {} attempted to read the thread of load {}", actor.getUserId(), loadId);
            throw new AccessDeniedException("Access Denied: You are not a party to this load");
        }

        log.debug("Fetching thread: loadId={}, userId={}, page={}", loadId, actor.getUserId(), pageable.getPageNumber());
        return messageRepository.findThreadForParticipant(loadId, actor.getUserId(), pageable)
                .map(messageMapper::toMessageResponse);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<MessageResponse> getInbox(Actor actor, Pageable pageable) {
        return messageRepository.findByRecipientIdOrderByCreatedAtDesc(actor.getUserId(), pageable)
                .map(messageMapper::toMessageResponse);
    }
}
