package com.swiftload.loadservice.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swiftload.common.contracts.BidEventContract;
import com.swiftload.common.contracts.LoadAssignedContract;
import com.swiftload.common.contracts.LoadStatusChangeContract;
import com.swiftload.common.exception.AccessDeniedException;
import com.swiftload.common.exception.ResourceNotFoundException;
import com.swiftload.loadservice.dto.BidRequest;
import com.swiftload.loadservice.dto.BidResponse;
import com.swiftload.loadservice.dto.LoadRequest;
import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.LoadTermsRequest;
import com.swiftload.loadservice.exception.InvalidLoadStateException;
import com.swiftload.loadservice.mapper.BidMapper;
import com.swiftload.loadservice.mapper.LoadMapper;
import com.swiftload.loadservice.model.Bid;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.model.LoadStatus;
import com.swiftload.loadservice.model.OutboxEvent;
import com.swiftload.loadservice.model.UserRole;
import com.swiftload.loadservice.repository.OutboxRepository;
import com.swiftload.loadservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentServiceImpl implements AssignmentService {

    private final LoadService loadService;
    private final BidService bidService;
    private final LoadMapper loadMapper;
    private final BidMapper bidMapper;
    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public LoadResponse postLoad(Actor actor, LoadRequest request) {
        log.info("Load creation process started. shipperId={}", actor.getUserId());

        if (actor.hasRole(UserRole.TRUCKER)) {
            log.warn("Access denied: Trucker {} attempted to post a load", actor.getUserId());
            throw new AccessDeniedException("Access Denied: Only shippers can post loads");
        }

        Load load = loadService.create(actor.getUserId(), request);
        saveOutboxEvent("LOAD", load.getId().toString(), "load.posted",
                statusChange(load, null, actor.getUserId()));

        return loadMapper.toLoadResponse(load);
    }

    @Override
    @Transactional
    public LoadResponse updateLoadTerms(UUID loadId, Actor actor, LoadTermsRequest request) {
        log.info("Load update process started. loadId={}, requestedBy={}", loadId, actor.getUserId());

        Load load = loadService.findLoadForUpdate(loadId);
        Load updated = loadService.updateTerms(load, actor, request);

        saveOutboxEvent("LOAD", loadId.toString(), "load.updated",
                statusChange(updated, updated.getStatus(), actor.getUserId()));

        return loadMapper.toLoadResponse(updated);
    }

    @Override
    @Transactional
    public LoadResponse cancelLoad(UUID loadId, Actor actor) {
        log.info("Cancel load process started. loadId={}, requestedBy={}", loadId, actor.getUserId());

        Load load = loadService.findLoadForUpdate(loadId);
        checkGuards(load, actor, LoadTransition.CANCEL);

        LoadStatus oldStatus = load.getStatus();
        UUID previousTrucker = load.getAssignedTruckerId();

        List<UUID> rejected = bidService.rejectPending(loadId);
        Load cancelled = loadService.setStatus(load, LoadStatus.CANCELLED);

        LoadStatusChangeContract contract = statusChange(cancelled, oldStatus, actor.getUserId());
        // the trucker losing the assignment still needs to hear about it
        contract.setAssignedTruckerId(previousTrucker);
        saveOutboxEvent("LOAD", loadId.toString(), "load.cancelled", contract);

        log.info("Load cancelled: loadId={}, from={}, cancelledBy={}, rejectedBids={}",
                loadId, oldStatus, actor.getUserId(), rejected.size());
        return loadMapper.toLoadResponse(cancelled);
    }

    @Override
    @Transactional
    public BidResponse placeBid(UUID loadId, Actor actor, BidRequest request) {
        log.info("Bid placement started. loadId={}, truckerId={}", loadId, actor.getUserId());

        if (!actor.hasRole(UserRole.TRUCKER)) {
            log.warn("Access denied: User {} with role {} attempted to bid on load {}",
                    actor.getUserId(), actor.getRole(), loadId);
            throw new AccessDeniedException("Access Denied: Only truckers can place bids");
        }

        Load load = loadService.findLoadForUpdate(loadId);
        BidPlacement placement = bidService.place(load, actor.getUserId(), request.getAmount(), request.getMessage());
        Bid bid = placement.getBid();

        saveOutboxEvent("BID", bid.getId().toString(), "bid.placed",
                bidEvent(bid, load, placement.getSupersededBidId()));

        return bidMapper.toBidResponse(bid);
    }

    @Override
    @Transactional
    public BidResponse withdrawBid(UUID bidId, Actor actor) {
        log.info("Bid withdrawal started. bidId={}, requestedBy={}", bidId, actor.getUserId());

        // lock order is always load first, then bid
        Load load = loadService.findLoadForUpdate(bidService.findLoadIdOfBid(bidId));
        Bid bid = bidService.withdraw(bidService.findBid(bidId), actor);

        saveOutboxEvent("BID", bidId.toString(), "bid.withdrawn", bidEvent(bid, load, null));
        return bidMapper.toBidResponse(bid);
    }

    @Override
    @Transactional
    public LoadResponse acceptBid(UUID loadId, UUID bidId, Actor actor) {
        log.info("Accept bid process started. loadId={}, bidId={}, requestedBy={}", loadId, bidId, actor.getUserId());

        Load load = loadService.findLoadForUpdate(loadId);
        Bid bid = bidService.findBid(bidId);
        if (!bid.getLoadId().equals(loadId)) {
            log.warn("Bid {} does not belong to load {} (belongs to {})", bidId, loadId, bid.getLoadId());
            throw new ResourceNotFoundException("Bid " + bidId + " not found on load " + loadId);
        }

        checkGuards(load, actor, LoadTransition.ACCEPT_BID);

        Bid accepted = bidService.accept(bid);
        Load assigned = loadService.assignTrucker(load, accepted.getTruckerId());
        List<UUID> rejected = bidService.rejectOthers(loadId, bidId);

        LoadAssignedContract contract = LoadAssignedContract.builder()
                .loadId(loadId)
                .shipperId(assigned.getShipperId())
                .truckerId(accepted.getTruckerId())
                .acceptedBidId(bidId)
                .amount(accepted.getAmount())
                .rejectedBidIds(rejected)
                .acceptedBy(actor.getUserId())
                .occurredAt(Instant.now())
                .build();
        saveOutboxEvent("LOAD", loadId.toString(), "load.assigned", contract);

        log.info("Bid accepted: loadId={}, bidId={}, truckerId={}, amount={}, rejectedBids={}",
                loadId, bidId, accepted.getTruckerId(), accepted.getAmount(), rejected.size());
        return loadMapper.toLoadResponse(assigned);
    }

    @Override
    @Transactional
    public BidResponse rejectBid(UUID bidId, Actor actor) {
        log.info("Reject bid process started. bidId={}, requestedBy={}", bidId, actor.getUserId());

        Load load = loadService.findLoadForUpdate(bidService.findLoadIdOfBid(bidId));
        Bid bid = bidService.findBid(bidId);

        if (load.getStatus() != LoadStatus.OPEN) {
            log.warn("Invalid state transition: loadId={}, currentStatus={}, attemptedAction=rejectBid",
                    load.getId(), load.getStatus());
            throw new InvalidLoadStateException(
                    "Bids can only be rejected while the load is OPEN. Current status: " + load.getStatus());
        }
        if (!actor.isAdmin() && !load.getShipperId().equals(actor.getUserId())) {
            log.warn("Access denied: User {} attempted to reject bid {} on load {} owned by {}",
                    actor.getUserId(), bidId, load.getId(), load.getShipperId());
            throw new AccessDeniedException("Access Denied: Only the shipper who posted this load can reject bids");
        }

        Bid rejected = bidService.reject(bid);
        saveOutboxEvent("BID", bidId.toString(), "bid.rejected", bidEvent(rejected, load, null));

        return bidMapper.toBidResponse(rejected);
    }

    @Override
    @Transactional
    public LoadResponse advanceToInTransit(UUID loadId, Actor actor) {
        return applyTransition(loadId, actor, LoadTransition.MARK_IN_TRANSIT, "load.in_transit");
    }

    @Override
    @Transactional
    public LoadResponse markComplete(UUID loadId, Actor actor) {
        return applyTransition(loadId, actor, LoadTransition.COMPLETE, "load.completed");
    }

    @Override
    public boolean isParty(Load load, UUID userId) {
        return !LoadParty.of(load, userId).isEmpty() || bidService.hasActiveBid(load.getId(), userId);
    }

    private LoadResponse applyTransition(UUID loadId, Actor actor, LoadTransition transition, String eventType) {
        log.info("Load transition requested: loadId={}, action={}, requestedBy={}",
                loadId, transition.getAction(), actor.getUserId());

        Load load = loadService.findLoadForUpdate(loadId);
        checkGuards(load, actor, transition);

        LoadStatus oldStatus = load.getStatus();
        Load updated = loadService.setStatus(load, transition.getTarget());

        saveOutboxEvent("LOAD", loadId.toString(), eventType, statusChange(updated, oldStatus, actor.getUserId()));
        return loadMapper.toLoadResponse(updated);
    }

    private void checkGuards(Load load, Actor actor, LoadTransition transition) {
        LoadStatus current = load.getStatus();

        if (current.isTerminal()) {
            log.warn("Invalid state transition: loadId={}, currentStatus={}, attemptedAction={}, attemptedBy={}",
                    load.getId(), current, transition.getAction(), actor.getUserId());
            throw new InvalidLoadStateException(
                    "Cannot " + transition.getAction() + " a load that is already " + current + ".");
        }

        Set<LoadParty> parties = LoadParty.of(load, actor.getUserId());
        if (!actor.isAdmin() && !transition.permits(parties)) {
            log.warn("Access denied: User {} attempted to {} load {} (owner: {}, assignedTrucker: {})",
                    actor.getUserId(), transition.getAction(), load.getId(),
                    load.getShipperId(), load.getAssignedTruckerId());
            throw new AccessDeniedException(
                    "Access Denied: Only " + describe(transition) + " can " + transition.getAction() + " this load");
        }

        if (!LoadStateMachine.canTransition(current, transition.getTarget())) {
            log.warn("Invalid state transition: loadId={}, currentStatus={}, attemptedAction={}, attemptedBy={}",
                    load.getId(), current, transition.getAction(), actor.getUserId());
            throw new InvalidLoadStateException(
                    "Cannot " + transition.getAction() + " a load that is " + current + ".");
        }

        if (actor.isAdmin() && !transition.permits(parties)) {
            log.info("Admin override: admin {} will {} load {}", actor.getUserId(), transition.getAction(), load.getId());
        }
    }

    private static String describe(LoadTransition transition) {
        Set<LoadParty> permitted = transition.getPermittedParties();
        if (permitted.contains(LoadParty.OWNER) && permitted.contains(LoadParty.ASSIGNED_TRUCKER)) {
            return "the shipper or the assigned trucker";
        }
        return permitted.contains(LoadParty.OWNER) ? "the shipper who posted it" : "the assigned trucker";
    }

    private LoadStatusChangeContract statusChange(Load load, LoadStatus oldStatus, UUID changedBy) {
        return LoadStatusChangeContract.builder()
                .loadId(load.getId())
                .shipperId(load.getShipperId())
                .assignedTruckerId(load.getAssignedTruckerId())
                .oldStatus(oldStatus != null ? oldStatus.name() : null)
                .status(load.getStatus().name())
                .rate(load.getRate())
                .pickupCity(load.getPickupCity())
                .deliveryCity(load.getDeliveryCity())
                .changedBy(changedBy)
                .occurredAt(Instant.now())
                .build();
    }

    private BidEventContract bidEvent(Bid bid, Load load, UUID supersededBidId) {
        return BidEventContract.builder()
                .bidId(bid.getId())
                .loadId(load.getId())
                .truckerId(bid.getTruckerId())
                .shipperId(load.getShipperId())
                .amount(bid.getAmount())
                .status(bid.getStatus().name())
                .supersededBidId(supersededBidId)
                .occurredAt(Instant.now())
                .build();
    }

    private void saveOutboxEvent(String aggregateType, String aggregateId, String type, Object payloadObj) {
        try {
            String payload = objectMapper.writeValueAsString(payloadObj);
            OutboxEvent event = OutboxEvent.builder()
                    .aggregateType(aggregateType)
                    .aggregateId(aggregateId)
                    .type(type)
                    .payload(payload)
                    .createdAt(LocalDateTime.now())
                    .processed(false)
                    .build();
            outboxRepository.save(event);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize/save outbox event", e);
        }
    }
}
