package com.fever.resilience.infrastructure.pool;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PoolStats(
        @JsonProperty("active_connections") int activeConnections,
        @JsonProperty("max_connections") int maxConnections
) {
    @JsonProperty("available_connections")
    public int availableConnections() {
        return Math.max(0, maxConnections - activeConnections);
    }
}
