package com.swiftload.loadservice.dto;

import com.swiftload.loadservice.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Role-specific overview: a shipper sees their loads and the bids on them, a
 * trucker sees the loads assigned to them and their own bids, an admin sees the
 * most recent activity on the board.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardResponse {
    private UserRole role;
    private List<LoadResponse> loads;
    private List<BidResponse> bids;
}
