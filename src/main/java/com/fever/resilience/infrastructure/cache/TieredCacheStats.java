package com.fever.resilience.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics of both tiers plus a hit rate weighted towards the cheaper memory tier
 */
public record TieredCacheStats(
        @JsonProperty("memory_cache") CacheStats memory,
        @JsonProperty("disk_cache") CacheStats disk,
        @JsonProperty("total_hit_rate") double totalHitRate
) {
    public static TieredCacheStats blend(CacheStats memory, CacheStats disk,
                                         double memoryWeight, double diskWeight) {
        double blended = memory.hitRate() * memoryWeight + disk.hitRate() * diskWeight;
        return new TieredCacheStats(memory, disk, blended);
    }
}
