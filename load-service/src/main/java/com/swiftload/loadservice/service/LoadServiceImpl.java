package com.swiftload.loadservice.service;

import com.swiftload.common.exception.AccessDeniedException;
import com.swiftload.common.exception.ResourceNotFoundException;
import com.swiftload.common.exception.ValidationException;
import com.swiftload.loadservice.dto.BidResponse;
import com.swiftload.loadservice.dto.DashboardResponse;
import com.swiftload.loadservice.dto.LoadRequest;
import com.swiftload.loadservice.dto.LoadResponse;
import com.swiftload.loadservice.dto.LoadSearchCriteria;
import com.swiftload.loadservice.dto.LoadTermsRequest;
import com.swiftload.loadservice.exception.InvalidLoadStateException;
import com.swiftload.loadservice.mapper.BidMapper;
import com.swiftload.loadservice.mapper.LoadMapper;
import com.swiftload.loadservice.model.Bid;
import com.swiftload.loadservice.model.Load;
import com.swiftload.loadservice.model.LoadStatus;
import com.swiftload.loadservice.repository.BidRepository;
import com.swiftload.loadservice.repository.LoadRepository;
import com.swiftload.loadservice.security.Actor;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class LoadServiceImpl implements LoadService {

    private final LoadRepository loadRepository;
    private final BidRepository bidRepository;
    private final LoadMapper loadMapper;
    private final BidMapper bidMapper;

    @Override
    @Transactional
    public Load create(UUID ownerId, LoadRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        requireText(errors, "title", request.getTitle(), "Title cannot be blank");
        requireText(errors, "pickupCity", request.getPickupCity(), "Pickup city cannot be blank");
        requireText(errors, "deliveryCity", request.getDeliveryCity(), "Delivery city cannot be blank");
        if (request.getRate() == null) {
            errors.put("rate", "Rate cannot be null");
        }
        validateTerms(errors, request.getRate(), request.getWeightLbs(),
                request.getPickupDate(), request.getDeliveryDate());
        if (!errors.isEmpty()) {
            log.warn("Load rejected: ownerId={}, errors={}", ownerId, errors);
            throw new ValidationException(errors);
        }

        Load load = loadMapper.toLoad(request);
        load.setTitle(request.getTitle().trim());
        load.setPickupCity(request.getPickupCity().trim());
        load.setDeliveryCity(request.getDeliveryCity().trim());
        load.setShipperId(ownerId);
        load.setStatus(LoadStatus.OPEN);
        load.setAssignedTruckerId(null);

        Load saved = loadRepository.save(load);
        log.info("Load saved to database. ID: {}, shipperId={}, rate={}", saved.getId(), ownerId, saved.getRate());
        return saved;
    }

    @Override
    public Load findLoad(UUID loadId) {
        return loadRepository.findById(loadId)
                .orElseThrow(() -> {
                    log.warn("Load not found: loadId={}", loadId);
                    return new ResourceNotFoundException("Load not found with id: " + loadId);
                });
    }

    @Override
    public Load findLoadForUpdate(UUID loadId) {
        return loadRepository.findByIdWithLock(loadId)
                .orElseThrow(() -> {
                    log.warn("Load not found: loadId={}", loadId);
                    return new ResourceNotFoundException("Load not found with id: " + loadId);
                });
    }

    @Override
    @Transactional
    public Load updateTerms(Load load, Actor actor, LoadTermsRequest request) {
        if (!actor.isAdmin() && !load.getShipperId().equals(actor.getUserId())) {
            log.warn("Access denied: User {} attempted to edit load {} owned by {}",
                    actor.getUserId(), load.getId(), load.getShipperId());
            throw new AccessDeniedException("Access Denied: Only the shipper who posted this load can edit it");
        }
        if (load.getStatus() != LoadStatus.OPEN) {
            log.warn("Invalid state transition: loadId={}, currentStatus={}, attemptedAction=updateTerms",
                    load.getId(), load.getStatus());
            throw new InvalidLoadStateException(
                    "Load terms can only be changed while OPEN. Current status: " + load.getStatus());
        }

        Map<String, String> errors = new LinkedHashMap<>();
        rejectBlank(errors, "title", request.getTitle(), "Title cannot be blank");
        rejectBlank(errors, "pickupCity", request.getPickupCity(), "Pickup city cannot be blank");
        rejectBlank(errors, "deliveryCity", request.getDeliveryCity(), "Delivery city cannot be blank");
        LocalDate pickupDate = request.getPickupDate() != null ? request.getPickupDate() : load.getPickupDate();
        LocalDate deliveryDate = request.getDeliveryDate() != null ? request.getDeliveryDate() : load.getDeliveryDate();
        validateTerms(errors, request.getRate(), request.getWeightLbs(), pickupDate, deliveryDate);
        if (!errors.isEmpty()) {
            log.warn("Load update rejected: loadId={}, errors={}", load.getId(), errors);
            throw new ValidationException(errors);
        }

        loadMapper.updateLoadFromRequest(request, load);
        if (request.getTitle() != null) {
            load.setTitle(request.getTitle().trim());
        }
        if (request.getPickupCity() != null) {
            load.setPickupCity(request.getPickupCity().trim());
        }
        if (request.getDeliveryCity() != null) {
            load.setDeliveryCity(request.getDeliveryCity().trim());
        }
        Load saved = loadRepository.save(load);
        log.info("Load terms updated: loadId={}, updatedBy={}", load.getId(), actor.getUserId());
        return saved;
    }

    @Override
    @Transactional
    public Load setStatus(Load load, LoadStatus target) {
        LoadStateMachine.requireTransition(load, target);

        LoadStatus oldStatus = load.getStatus();
        load.setStatus(target);
        if (!target.requiresAssignedTrucker()) {
            load.setAssignedTruckerId(null);
        } else if (load.getAssignedTruckerId() == null) {
            throw new InvalidLoadStateException("Load " + load.getId() + " has no assigned trucker");
        }

        Load saved = loadRepository.save(load);
        log.info("Load status updated: loadId={}, from={}, to={}", load.getId(), oldStatus, target);
        return saved;
    }

    @Override
    @Transactional
    public Load assignTrucker(Load load, UUID truckerId) {
        LoadStateMachine.requireTransition(load, LoadStatus.ASSIGNED);

        load.setStatus(LoadStatus.ASSIGNED);
        load.setAssignedTruckerId(truckerId);

        Load saved = loadRepository.save(load);
        log.info("Load status updated: loadId={}, from={}, to={}, trucker={}",
                load.getId(), LoadStatus.OPEN, LoadStatus.ASSIGNED, truckerId);
        return saved;
    }

    @Override
    public LoadResponse getLoad(UUID loadId) {
        return loadMapper.toLoadResponse(findLoad(loadId));
    }

    @Override
    public List<LoadResponse> searchLoads(LoadSearchCriteria criteria) {
        List<Load> loads = loadRepository.findAll(buildSpecification(criteria),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        log.debug("Load search returned {} results for {}", loads.size(), criteria);
        return loads.stream()
                .map(loadMapper::toLoadResponse)
                .collect(Collectors.toList());
    }

    @Override
    public DashboardResponse getDashboard(Actor actor) {
        List<Load> loads;
        List<Bid> bids;

        switch (actor.getRole()) {
            case SHIPPER -> {
                loads = loadRepository.findByShipperIdOrderByCreatedAtDesc(actor.getUserId());
                bids = bidRepository.findBidsOnShipperLoads(actor.getUserId());
            }
            case TRUCKER -> {
                loads = loadRepository.findByAssignedTruckerIdOrderByCreatedAtDesc(actor.getUserId());
                bids = bidRepository.findByTruckerIdOrderByCreatedAtDesc(actor.getUserId());
            }
            default -> {
                loads = loadRepository.findTop10ByOrderByCreatedAtDesc();
                bids = bidRepository.findTop10ByOrderByCreatedAtDesc();
            }
        }

        List<LoadResponse> loadResponses = loads.stream()
                .map(loadMapper::toLoadResponse)
                .collect(Collectors.toList());
        List<BidResponse> bidResponses = bids.stream()
                .map(bidMapper::toBidResponse)
                .collect(Collectors.toList());

        return DashboardResponse.builder()
                .role(actor.getRole())
                .loads(loadResponses)
                .bids(bidResponses)
                .build();
    }

    private Specification<Load> buildSpecification(LoadSearchCriteria criteria) {
        return (root, query, criteriaBuilder) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (hasText(criteria.getPickupCity())) {
                predicates.add(criteriaBuilder.like(criteriaBuilder.lower(root.get("pickupCity")),
                        contains(criteria.getPickupCity())));
            }
            if (hasText(criteria.getDeliveryCity())) {
                predicates.add(criteriaBuilder.like(criteriaBuilder.lower(root.get("deliveryCity")),
                        contains(criteria.getDeliveryCity())));
            }
            if (hasText(criteria.getEquipment())) {
                predicates.add(criteriaBuilder.like(criteriaBuilder.lower(root.get("equipment")),
                        contains(criteria.getEquipment())));
            }
            if (criteria.getMinRate() != null) {
                predicates.add(criteriaBuilder.greaterThanOrEqualTo(root.get("rate"), criteria.getMinRate()));
            }
            if (criteria.getMaxWeight() != null) {
                predicates.add(criteriaBuilder.lessThanOrEqualTo(root.get("weightLbs"), criteria.getMaxWeight()));
            }
            if (criteria.getStatus() != null) {
                predicates.add(criteriaBuilder.equal(root.get("status"), criteria.getStatus()));
            }

            return criteriaBuilder.and(predicates.toArray(new Predicate[0]));
        };
    }

    private void validateTerms(Map<String, String> errors, BigDecimal rate, Double weightLbs,
                               LocalDate pickupDate, LocalDate deliveryDate) {
        if (rate != null && rate.signum() <= 0) {
            errors.put("rate", "Rate must be greater than zero");
        }
        if (weightLbs != null && weightLbs < 0) {
            errors.put("weightLbs", "Weight cannot be negative");
        }
        if (pickupDate != null && deliveryDate != null && deliveryDate.isBefore(pickupDate)) {
            errors.put("deliveryDate", "Delivery date cannot be before pickup date");
        }
    }

    private void requireText(Map<String, String> errors, String field, String value, String message) {
        if (!hasText(value)) {
            errors.put(field, message);
        }
    }

    // For partial updates: absent is fine, present-but-blank is not
    private void rejectBlank(Map<String, String> errors, String field, String value, String message) {
        if (value != null && value.isBlank()) {
            errors.put(field, message);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String contains(String value) {
        return "%" + value.trim().toLowerCase(Locale.ROOT) + "%";
    }
}
