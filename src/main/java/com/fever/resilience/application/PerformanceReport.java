package com.fever.resilience.application;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fever.resilience.domain.model.OperationMetrics;
import com.fever.resilience.infrastructure.cache.CacheStats;
import com.fever.resilience.infrastructure.cache.TieredCacheStats;
import com.fever.resilience.infrastructure.pool.PoolStats;
import java.util.Map;

public record PerformanceReport(
        @JsonProperty("memory_cache") CacheStats memoryCache,
        @JsonProperty("tiered_cache") TieredCacheStats tieredCache,
        @JsonProperty("connection_pool") PoolStats connectionPool,
        @JsonProperty("performance_metrics") Map<String, OperationMetrics> performanceMetrics
) {}
