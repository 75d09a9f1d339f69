package com.fever.resilience.infrastructure.resilience;

import java.time.Duration;

/**
 * Error-rate bands used to derive the overall health status.
 * Rates are errors per minute over {@code window}.
 */
public record HealthThresholds(double degradedRate, double criticalRate, Duration window) {

    public HealthThresholds {
        if (criticalRate < degradedRate) {
            throw new IllegalArgumentException("criticalRate must not be below degradedRate");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public static HealthThresholds defaults() {
        return new HealthThresholds(1.0, 5.0, Duration.ofHours(1));
    }
}
