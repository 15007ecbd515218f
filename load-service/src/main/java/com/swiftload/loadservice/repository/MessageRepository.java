package com.swiftload.loadservice.repository;

import com.swiftload.loadservice.model.Message;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface MessageRepository extends JpaRepository<Message, UUID> {

    // Full thread of a load (admin view)
    Page<Message> findByLoadIdOrderByCreatedAtAscIdAsc(UUID loadId, Pageable pageable);

    // Messages on a load the user sent or received
    @Query(value = "SELECT m FROM Message m WHERE m.loadId = :loadId "
            + "AND (m.senderId = :userId OR m.recipientId = :userId) ORDER BY m.createdAt ASC, m.id ASC",
            countQuery = "SELECT COUNT(m) FROM Message m WHERE m.loadId = :loadId "
                    + "AND (m.senderId = :userId OR m.recipientId = :userId)")
    Page<Message> findThreadForParticipant(@Param("loadId") UUID loadId,
                                           @Param("userId") UUID userId,
                                           Pageable pageable);

    // Inbox: newest first
    Page<Message> findByRecipientIdOrderByCreatedAtDesc(UUID recipientId, Pageable pageable);
}
