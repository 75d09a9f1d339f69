package com.fever.resilience.application;

import com.fever.resilience.domain.model.SystemHealth;

/**
 * Read side of the resilience layer, for monitoring and troubleshooting.
 */
public interface SystemDiagnostics {

    /**
     * Overall status derived from the recent error rate, with breaker states and per-service health.
     */
    SystemHealth systemHealth();

    /**
     * Cache, pool and per-operation timing statistics.
     */
    PerformanceReport performanceReport();

    /**
     * Empty both caches, including the files of the disk tier.
     */
    void clearCaches();
}
