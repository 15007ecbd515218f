package com.swiftload.loadservice.repository;

import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.model.LoadStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoadRepository extends JpaRepository<Load, UUID>, JpaSpecificationExecutor<Load> {

    // loads posted by a shipper
    List<Load> findByShipperIdOrderByCreatedAtDesc(UUID shipperId);

    // loads a trucker is (or was) hauling
    List<Load> findByAssignedTruckerIdOrderByCreatedAtDesc(UUID truckerId);

    List<Load> findTop10ByOrderByCreatedAtDesc();

    long countByStatus(LoadStatus status);

    /**
     * Finds a load by ID with a pessimistic write lock (SELECT ... FOR UPDATE).
     * Every status transition and every bid placement goes through this, so two
     * concurrent accepts (or an accept racing a cancel) on the same load are
     * serialized and the loser sees the winner's status.
     *
     * Must be called within a @Transactional context.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM Load l WHERE l.id = :id")
    Optional<Load> findByIdWithLock(@Param("id") UUID id);
}
