package com.swiftload.loadservice.service;

import com.swiftload.common.exception.AccessDeniedException;
import com.swiftload.common.exception.ResourceNotFoundException;
import com.swiftload.common.exception.ValidationException;
import com.swiftload.loadservice.dto.MessageRequest;
import com.swiftload.loadservice.dto.MessageResponse;
import com.swiftload.loadservice.mapper.MessageMapper;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.model.LoadStatus;
import com.swiftload.loadservice.model.Message;
import com.swiftload.loadservice.model.UserAccount;
import com.swiftload.loadservice.model.UserRole;
import com.swiftload.loadservice.repository.MessageRepository;
import com.swiftload.loadservice.repository.UserAccountRepository;
import com.swiftload.loadservice.security.Actor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessageServiceImplTest {

    @Mock
    private MessageRepository messageRepository;
    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private LoadService loadService;
    @Mock
    private AssignmentService assignmentService;
    @Spy
    private MessageMapper messageMapper = Mappers.getMapper(MessageMapper.class);

    @InjectMocks
    private MessageServiceImpl messageService;

    private Load load;
    private Actor shipper;
    private Actor trucker;
    private UserAccount shipperAccount;
    private UserAccount truckerAccount;

    @BeforeEach
    void setUp() {
        shipper = Actor.of(UUID.randomUUID(), UserRole.SHIPPER);
        trucker = Actor.of(UUID.randomUUID(), UserRole.TRUCKER);

        load = new Load();
        load.setId(UUID.randomUUID());
        load.setShipperId(shipper.getUserId());
        load.setStatus(LoadStatus.OPEN);

        shipperAccount = UserAccount.builder().id(shipper.getUserId()).role(UserRole.SHIPPER).build();
        truckerAccount = UserAccount.builder().id(trucker.getUserId()).role(UserRole.TRUCKER).build();
    }

    private MessageRequest request(UUID recipientId, String body) {
        MessageRequest request = new MessageRequest();
        request.setRecipientId(recipientId);
        request.setBody(body);
        return request;
    }

    @Nested
    @DisplayName("sendMessage")
    class SendMessage {

        @Test
        @DisplayName("Should deliver between the shipper and a bidding trucker")
        void shouldSendBetweenParties() {
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(userAccountRepository.findById(shipper.getUserId())).thenReturn(Optional.of(shipperAccount));
            when(assignmentService.isParty(load, trucker.getUserId())).thenReturn(true);
            when(assignmentService.isParty(load, shipper.getUserId())).thenReturn(true);
            when(messageRepository.save(any(Message.class))).thenAnswer(i -> i.getArgument(0));

            MessageResponse response = messageService.sendMessage(load.getId(), trucker,
                    request(shipper.getUserId(), "  Can pick up Tuesday morning.  "));

            ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
            verify(messageRepository).save(captor.capture());
            assertThat(captor.getValue().getSenderId()).isEqualTo(trucker.getUserId());
            assertThat(captor.getValue().getRecipientId()).isEqualTo(shipper.getUserId());
            assertThat(response.getBody()).isEqualTo("Can pick up Tuesday morning.");
        }

        @Test
        @DisplayName("Should reject a trucker who never bid on the load")
        void shouldRejectNonPartySender() {
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(assignmentService.isParty(load, trucker.getUserId())).thenReturn(false);
            when(userAccountRepository.findById(shipper.getUserId())).thenReturn(Optional.of(shipperAccount));

            assertThatThrownBy(() -> messageService.sendMessage(load.getId(), trucker,
                    request(shipper.getUserId(), "Is this still available?")))
                    .isInstanceOf(AccessDeniedException.class);
            verify(messageRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should deny a non-party sender even when the recipient has no profile yet")
        void shouldDenyNonPartySenderWhenRecipientHasNoProfile() {
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(assignmentService.isParty(load, trucker.getUserId())).thenReturn(false);
            when(userAccountRepository.findById(shipper.getUserId())).thenReturn(Optional.empty());

            assertThatThrownBy(() -> messageService.sendMessage(load.getId(), trucker,
                    request(shipper.getUserId(), "Still need a truck?")))
                    .isInstanceOf(AccessDeniedException.class);
            verify(messageRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should let a non-party reach an admin")
        void shouldAllowNonPartyToMessageAdmin() {
            UserAccount adminAccount = UserAccount.builder().id(UUID.randomUUID()).role(UserRole.ADMIN).build();
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(assignmentService.isParty(load, trucker.getUserId())).thenReturn(false);
            when(userAccountRepository.findById(adminAccount.getId())).thenReturn(Optional.of(adminAccount));
            when(messageRepository.save(any(Message.class))).thenAnswer(i -> i.getArgument(0));

            MessageResponse response = messageService.sendMessage(load.getId(), trucker,
                    request(adminAccount.getId(), "The shipper is not answering."));

            assertThat(response.getRecipientId()).isEqualTo(adminAccount.getId());
        }

        @Test
        @DisplayName("Should reject a recipient who is not a party")
        void shouldRejectNonPartyRecipient() {
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(userAccountRepository.findById(trucker.getUserId())).thenReturn(Optional.of(truckerAccount));
            when(assignmentService.isParty(load, shipper.getUserId())).thenReturn(true);
            when(assignmentService.isParty(load, trucker.getUserId())).thenReturn(false);

            assertThatThrownBy(() -> messageService.sendMessage(load.getId(), shipper,
                    request(trucker.getUserId(), "Want to bid?")))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("Should let an admin message anyone about any load")
        void shouldAllowAdmin() {
            Actor admin = Actor.of(UUID.randomUUID(), UserRole.ADMIN);
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(userAccountRepository.findById(trucker.getUserId())).thenReturn(Optional.of(truckerAccount));
            when(messageRepository.save(any(Message.class))).thenAnswer(i -> i.getArgument(0));

            messageService.sendMessage(load.getId(), admin, request(trucker.getUserId(), "Please update your MC number."));

            verifyNoInteractions(assignmentService);
            verify(messageRepository).save(any(Message.class));
        }

        @Test
        @DisplayName("Should reject blank, oversized and self-addressed messages")
        void shouldValidateInput() {
            assertThatThrownBy(() -> messageService.sendMessage(load.getId(), trucker, request(shipper.getUserId(), "   ")))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> messageService.sendMessage(load.getId(), trucker,
                    request(shipper.getUserId(), "x".repeat(MessageServiceImpl.MAX_BODY_LENGTH + 1))))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> messageService.sendMessage(load.getId(), trucker, request(trucker.getUserId(), "hi")))
                    .isInstanceOfSatisfying(ValidationException.class,
                            ex -> assertThat(ex.getFieldErrors()).containsKey("recipientId"));
            verifyNoInteractions(messageRepository);
        }

        @Test
        @DisplayName("Should report an unknown recipient as not found")
        void shouldRejectUnknownRecipient() {
            UUID stranger = UUID.randomUUID();
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(assignmentService.isParty(load, shipper.getUserId())).thenReturn(true);
            when(userAccountRepository.findById(stranger)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> messageService.sendMessage(load.getId(), shipper, request(stranger, "hello")))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("getThread")
    class GetThread {

        @Test
        @DisplayName("Should page a party's own conversation oldest first")
        void shouldReturnPartyThread() {
            Pageable firstPage = PageRequest.of(0, 20);
            Message message = Message.builder().id(UUID.randomUUID()).loadId(load.getId())
                    .senderId(trucker.getUserId()).recipientId(shipper.getUserId()).body("hi").build();
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(assignmentService.isParty(load, trucker.getUserId())).thenReturn(true);
            when(messageRepository.findThreadForParticipant(load.getId(), trucker.getUserId(), firstPage))
                    .thenReturn(new PageImpl<>(List.of(message), firstPage, 1));

            Page<MessageResponse> page = messageService.getThread(load.getId(), trucker, firstPage);

            assertThat(page.getContent()).extracting(MessageResponse::getBody).containsExactly("hi");
        }

        @Test
        @DisplayName("Should give admins the whole thread")
        void shouldReturnWholeThreadToAdmin() {
            Actor admin = Actor.of(UUID.randomUUID(), UserRole.ADMIN);
            Pageable firstPage = PageRequest.of(0, 20);
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(messageRepository.findByLoadIdOrderByCreatedAtAscIdAsc(load.getId(), firstPage))
                    .thenReturn(Page.empty(firstPage));

            messageService.getThread(load.getId(), admin, firstPage);

            verify(messageRepository).findByLoadIdOrderByCreatedAtAscIdAsc(load.getId(), firstPage);
            verifyNoInteractions(assignmentService);
        }

        @Test
        @DisplayName("Should hide the thread from non-parties")
        void shouldRejectNonParty() {
            when(loadService.findLoad(load.getId())).thenReturn(load);
            when(assignmentService.isParty(load, trucker.getUserId())).thenReturn(false);

            assertThatThrownBy(() -> messageService.getThread(load.getId(), trucker, PageRequest.of(0, 20)))
                    .isInstanceOf(AccessDeniedException.class);
        }
    }
}
