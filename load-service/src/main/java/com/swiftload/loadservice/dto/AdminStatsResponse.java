package com.swiftload.loadservice.dto;

import com.swiftload.loadservice.model.LoadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminStatsResponse {
    private long users;
    private long loads;
    private long openLoads;
    private long bids;
    private Map<LoadStatus, Long> loadsByStatus;
    private List<UserProfileResponse> recentUsers;
}
