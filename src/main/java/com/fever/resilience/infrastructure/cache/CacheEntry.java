package com.fever.resilience.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached value with its lifetime and usage metadata.
 * Mutable hit count is only touched while the owning cache holds its lock.
 */
public final class CacheEntry<V> {

    private final V value;
    private final Instant createdAt;
    private final Duration ttl;
    private final long sizeBytes;
    private long hitCount;

    public CacheEntry(V value, Instant createdAt, Duration ttl, long sizeBytes) {
        this.value = value;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.sizeBytes = sizeBytes;
    }

    public V value() {
        return value;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Duration ttl() {
        return ttl;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public long hitCount() {
        return hitCount;
    }

    void recordHit() {
        hitCount++;
    }

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    /**
     * Live while strictly less than ttl has elapsed since creation
     */
    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt());
    }

    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, expiresAt());
        return left.isNegative() ? Duration.ZERO : left;
    }
}
