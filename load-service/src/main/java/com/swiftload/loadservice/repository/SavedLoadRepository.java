package com.swiftload.loadservice.repository;

import com.swiftload.loadservice.model.SavedLoad;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SavedLoadRepository extends JpaRepository<SavedLoad, UUID> {

    Optional<SavedLoad> findByUserIdAndLoadId(UUID userId, UUID loadId);

    List<SavedLoad> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
