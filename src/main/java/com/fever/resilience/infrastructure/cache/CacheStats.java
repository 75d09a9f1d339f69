package com.fever.resilience.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cache performance metrics
 */
public record CacheStats(
        long hits,
        long misses,
        long evictions,
        long expirations,
        @JsonProperty("current_size") int currentSize,
        @JsonProperty("max_size") int maxSize,
        @JsonProperty("total_size_bytes") long totalSizeBytes
) {
    public static CacheStats empty(int maxSize) {
        return new CacheStats(0, 0, 0, 0, 0, maxSize, 0);
    }

    @JsonProperty("hit_rate")
    public double hitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    @JsonProperty("average_entry_size")
    public double averageEntrySize() {
        return currentSize > 0 ? (double) totalSizeBytes / currentSize : 0.0;
    }

    public String summary() {
        return String.format("Hit rate: %.1f%%, Entries: %d/%d, Evictions: %d",
                hitRate() * 100, currentSize, maxSize, evictions);
    }
}
