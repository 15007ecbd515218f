package com.swiftload.loadservice.service;

import com.swiftload.common.exception.AccessDeniedException;
import com.swiftload.loadservice.dto.AdminStatsResponse;
import com.swiftload.loadservice.dto.UserProfileResponse;
import com.swiftload.loadservice.mapper.UserAccountMapper;
import com.swiftload.loadservice.model.LoadStatus;
import com.swiftload.loadservice.repository.BidRepository;
import com.swiftload.loadservice.repository.LoadRepository;
import com.swiftload.loadservice.repository.UserAccountRepository;
import com.swiftload.loadservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AdminServiceImpl implements AdminService {

    private final UserAccountRepository userAccountRepository;
    private final LoadRepository loadRepository;
    private final BidRepository bidRepository;
    private final UserAccountMapper userAccountMapper;

    @Override
    @Transactional(readOnly = true)
    public AdminStatsResponse getStats(Actor actor) {
        if (!actor.isAdmin()) {
            log.warn("Access denied: User {} with role {} requested admin stats", actor.getUserId(), actor.getRole());
            throw new AccessDeniedException("Access Denied: Admin role required");
        }

        Map<LoadStatus, Long> byStatus = new EnumMap<>(LoadStatus.class);
        for (LoadStatus status : LoadStatus.values()) {
            byStatus.put(status, loadRepository.countByStatus(status));
        }

        List<UserProfileResponse> recentUsers = userAccountRepository.findTop20ByOrderByCreatedAtDesc().stream()
                .map(userAccountMapper::toUserProfileResponse)
                .collect(Collectors.toList());

        return AdminStatsResponse.builder()
                .users(userAccountRepository.count())
                .loads(loadRepository.count())
                .openLoads(byStatus.get(LoadStatus.OPEN))
                .bids(bidRepository.count())
                .loadsByStatus(byStatus)
                .recentUsers(recentUsers)
                .build();
    }
}
