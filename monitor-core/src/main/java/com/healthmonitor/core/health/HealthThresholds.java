package com.healthmonitor.core.health;

import com.healthmonitor.core.model.IntegrationStatus;

/**
 * Maps a success rate and a 24h error count onto a three-level status.
 *
 * <ul>
 *   <li>HEALTHY: success rate at least 98% and fewer than 5 errors</li>
 *   <li>DEGRADED: otherwise, success rate at least 90% or fewer than 20 errors</li>
 *   <li>DOWN: everything else</li>
 * </ul>
 */
public final class HealthThresholds {

    public static final double HEALTHY_SUCCESS_RATE = 98.0;
    public static final int HEALTHY_MAX_ERRORS = 5;
    public static final double DEGRADED_SUCCESS_RATE = 90.0;
    public static final int DEGRADED_MAX_ERRORS = 20;

    private HealthThresholds() {
    }

    /**
     * @param successRate Success percentage in [0, 100]
     * @param errorsLast24h Error count in the trailing 24 hours
     */
    public static IntegrationStatus calculateStatus(double successRate, long errorsLast24h) {
        if (successRate >= HEALTHY_SUCCESS_RATE && errorsLast24h < HEALTHY_MAX_ERRORS) {
            return IntegrationStatus.HEALTHY;
        }
        if (successRate >= DEGRADED_SUCCESS_RATE || errorsLast24h < DEGRADED_MAX_ERRORS) {
            return IntegrationStatus.DEGRADED;
        }
        return IntegrationStatus.DOWN;
    }
}
