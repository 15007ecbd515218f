package com.swiftload.loadservice.service;

import com.swiftload.loadservice.dto.AdminStatsResponse;
import com.swiftload.loadservice.security.Actor;

public interface AdminService {

    /**
     * Board-wide counters and the newest accounts. Admins only.
     */
    AdminStatsResponse getStats(Actor actor);
}
