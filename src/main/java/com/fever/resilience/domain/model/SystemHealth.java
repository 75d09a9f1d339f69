package com.fever.resilience.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Aggregated health snapshot across breakers, degraded services and recent errors
 */
public record SystemHealth(
        @JsonProperty("overall_health") String overallHealth,
        @JsonProperty("error_rate_per_minute") double errorRatePerMinute,
        @JsonProperty("service_health") Map<String, String> serviceHealth,
        @JsonProperty("circuit_breaker_status") Map<String, CircuitState> circuitBreakerStatus,
        @JsonProperty("recent_errors") int recentErrors,
        @JsonProperty("total_errors") int totalErrors
) {
    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String CRITICAL = "critical";

    public SystemHealth {
        serviceHealth = Map.copyOf(serviceHealth);
        circuitBreakerStatus = Map.copyOf(circuitBreakerStatus);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(overallHealth);
    }
}
