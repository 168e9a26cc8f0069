package com.example.authservice.dto;

import java.util.Map;

/**
 * Directory statistics. "Recent" means the last 30 days.
 */
public record UserStatsResponse(
    long totalUsers,
    long activeUsers,
    long verifiedUsers,
    long lockedUsers,
    Map<String, Long> usersByRole,
    long recentRegistrations,
    long recentLogins
) {
}
