package com.swiftload.loadservice.service;

import com.swiftload.common.exception.AccessDeniedException;
import com.swiftload.common.exception.ResourceNotFoundException;
import com.swiftload.common.exception.ValidationException;
import com.swiftload.loadservice.dto.BidResponse;
import com.swiftload.loadservice.exception.InvalidLoadStateException;
import com.swiftload.loadservice.mapper.BidMapper;
import com.swiftload.loadservice.model.Bid;
import com.swiftload.loadservice.model.BidStatus;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.model.LoadStatus;
import com.swiftload.loadservice.model.UserRole;
import com.swiftload.loadservice.repository.BidRepository;
import com.swiftload.loadservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class BidServiceImpl implements BidService {

    private static final EnumSet<BidStatus> ACTIVE_STATUSES = EnumSet.of(BidStatus.PENDING, BidStatus.ACCEPTED);

    private final BidRepository bidRepository;
    private final LoadService loadService;
    private final BidMapper bidMapper;

    @Override
    public UUID findLoadIdOfBid(UUID bidId) {
        return bidRepository.findLoadIdByBidId(bidId)
                .orElseThrow(() -> {
                    log.warn("Bid not found: bidId={}", bidId);
                    return new ResourceNotFoundException("Bid not found with id: " + bidId);
                });
    }

    @Override
    public Bid findBid(UUID bidId) {
        return bidRepository.findById(bidId)
                .orElseThrow(() -> {
                    log.warn("Bid not found: bidId={}", bidId);
                    return new ResourceNotFoundException("Bid not found with id: " + bidId);
                });
    }

    @Override
    @Transactional
    public BidPlacement place(Load load, UUID truckerId, BigDecimal amount, String message) {
        if (load.getStatus() != LoadStatus.OPEN) {
            log.warn("Invalid state transition: loadId={}, currentStatus={}, attemptedAction=placeBid, truckerId={}",
                    load.getId(), load.getStatus(), truckerId);
            throw new InvalidLoadStateException(
                    "Bids can only be placed on OPEN loads. Current status: " + load.getStatus());
        }
        if (amount == null || amount.signum() <= 0) {
            log.warn("Bid rejected: loadId={}, truckerId={}, amount={}", load.getId(), truckerId, amount);
            throw new ValidationException("amount", "Bid amount must be greater than zero");
        }

        // At most one live bid per trucker per load
        UUID supersededBidId = null;
        Optional<Bid> previous = bidRepository.findFirstByLoadIdAndTruckerIdAndStatus(
                load.getId(), truckerId, BidStatus.PENDING);
        if (previous.isPresent()) {
            Bid prior = previous.get();
            prior.setStatus(BidStatus.WITHDRAWN);
            bidRepository.save(prior);
            supersededBidId = prior.getId();
            log.info("Previous bid superseded: bidId={}, loadId={}, truckerId={}",
                    prior.getId(), load.getId(), truckerId);
        }

        Bid bid = Bid.builder()
                .loadId(load.getId())
                .truckerId(truckerId)
                .amount(amount)
                .message(message)
                .status(BidStatus.PENDING)
                .build();

        Bid saved = bidRepository.save(bid);
        log.info("Bid placed: bidId={}, loadId={}, truckerId={}, amount={}",
                saved.getId(), load.getId(), truckerId, amount);
        return new BidPlacement(saved, supersededBidId);
    }

    @Override
    @Transactional
    public Bid withdraw(Bid bid, Actor actor) {
        requirePending(bid, "withdraw");

        if (!actor.isAdmin() && !bid.getTruckerId().equals(actor.getUserId())) {
            log.warn("Access denied: User {} attempted to withdraw bid {} placed by {}",
                    actor.getUserId(), bid.getId(), bid.getTruckerId());
            throw new AccessDeniedException("Access Denied: Only the trucker who placed this bid can withdraw it");
        }

        bid.setStatus(BidStatus.WITHDRAWN);
        Bid saved = bidRepository.save(bid);
        log.info("Bid status updated: bidId={}, from={}, to={}, by={}",
                bid.getId(), BidStatus.PENDING, BidStatus.WITHDRAWN, actor.getUserId());
        return saved;
    }

    @Override
    @Transactional
    public Bid accept(Bid bid) {
        requirePending(bid, "accept");

        bid.setStatus(BidStatus.ACCEPTED);
        Bid saved = bidRepository.save(bid);
        log.info("Bid status updated: bidId={}, from={}, to={}", bid.getId(), BidStatus.PENDING, BidStatus.ACCEPTED);
        return saved;
    }

    @Override
    @Transactional
    public Bid reject(Bid bid) {
        requirePending(bid, "reject");

        bid.setStatus(BidStatus.REJECTED);
        Bid saved = bidRepository.save(bid);
        log.info("Bid status updated: bidId={}, from={}, to={}", bid.getId(), BidStatus.PENDING, BidStatus.REJECTED);
        return saved;
    }

    @Override
    @Transactional
    public List<UUID> rejectOthers(UUID loadId, UUID acceptedBidId) {
        List<UUID> rejected = new ArrayList<>();
        for (Bid other : bidRepository.findByLoadIdAndStatus(loadId, BidStatus.PENDING)) {
            if (other.getId().equals(acceptedBidId)) {
                continue;
            }
            other.setStatus(BidStatus.REJECTED);
            bidRepository.save(other);
            rejected.add(other.getId());
        }
        log.info("Rejected {} competing bids: loadId={}, acceptedBidId={}", rejected.size(), loadId, acceptedBidId);
        return rejected;
    }

    @Override
    @Transactional
    public List<UUID> rejectPending(UUID loadId) {
        return rejectOthers(loadId, null);
    }

    @Override
    public boolean hasActiveBid(UUID loadId, UUID truckerId) {
        return bidRepository.existsByLoadIdAndTruckerIdAndStatusIn(loadId, truckerId, ACTIVE_STATUSES);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BidResponse> listForLoad(UUID loadId, Actor actor) {
        Load load = loadService.findLoad(loadId);
        List<Bid> bids;
        if (actor.isAdmin() || load.getShipperId().equals(actor.getUserId())) {
            bids = bidRepository.findByLoadIdOrderByAmountAscCreatedAtAscIdAsc(load.getId());
        } else if (actor.hasRole(UserRole.TRUCKER)) {
            bids = bidRepository.findByLoadIdAndTruckerIdOrderByAmountAscCreatedAtAscIdAsc(load.getId(), actor.getUserId());
        } else {
            log.warn("Access denied: User {} attempted to list bids on load {} owned by {}",
                    actor.getUserId(), load.getId(), load.getShipperId());
            throw new AccessDeniedException("Access Denied: Only the shipper who posted this load can see its bids");
        }

        return bids.stream()
                .map(bidMapper::toBidResponse)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<BidResponse> listMine(Actor actor) {
        if (!actor.hasRole(UserRole.TRUCKER)) {
            log.warn("Access denied: User {} with role {} requested trucker bids", actor.getUserId(), actor.getRole());
            throw new AccessDeniedException("Access Denied: Only truckers have bids");
        }
        return bidRepository.findByTruckerIdOrderByCreatedAtDesc(actor.getUserId()).stream()
                .map(bidMapper::toBidResponse)
                .collect(Collectors.toList());
    }

    private void requirePending(Bid bid, String action) {
        if (bid.getStatus() != BidStatus.PENDING) {
            log.warn("Invalid state transition: bidId={}, currentStatus={}, attemptedAction={}",
                    bid.getId(), bid.getStatus(), action);
            throw new InvalidLoadStateException(
                    "Only PENDING bids can be " + pastTense(action) + ". Current status: " + bid.getStatus());
        }
    }

    private static String pastTense(String action) {
        return switch (action) {
            case "withdraw" -> "withdrawn";
            case "accept" -> "accepted";
            default -> "rejected";
        };
    }
}
