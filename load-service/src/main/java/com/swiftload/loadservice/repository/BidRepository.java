package com.swiftload.loadservice.repository;

import com.swiftload.loadservice.model.Bid;
import com.swiftload.loadservice.model.BidStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BidRepository extends JpaRepository<Bid, UUID> {

    // cheapest first, then earliest
    List<Bid> findByLoadIdOrderByAmountAscCreatedAtAscIdAsc(UUID loadId);

    List<Bid> findByLoadIdAndTruckerIdOrderByAmountAscCreatedAtAscIdAsc(UUID loadId, UUID truckerId);

    List<Bid> findByLoadIdAndStatus(UUID loadId, BidStatus status);

    Optional<Bid> findFirstByLoadIdAndTruckerIdAndStatus(UUID loadId, UUID truckerId, BidStatus status);

    boolean existsByLoadIdAndTruckerIdAndStatusIn(UUID loadId, UUID truckerId, Collection<BidStatus> statuses);

    List<Bid> findByTruckerIdOrderByCreatedAtDesc(UUID truckerId);

    List<Bid> findTop10ByOrderByCreatedAtDesc();

    /**
     * Reads only the owning load id, without putting the bid into the
     * persistence context. Lets callers lock the load before loading the bid.
     */
    @Query("SELECT b.loadId FROM Bid b WHERE b.id = :bidId")
    Optional<UUID> findLoadIdByBidId(@Param("bidId") UUID bidId);

    @Query("SELECT b FROM Bid b WHERE b.loadId IN "
            + "(SELECT l.id FROM Load l WHERE l.shipperId = :shipperId) ORDER BY b.createdAt DESC")
    List<Bid> findBidsOnShipperLoads(@Param("shipperId") UUID shipperId);
}
