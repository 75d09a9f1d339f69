package com.fever.resilience.infrastructure.cache;

import com.fever.resilience.domain.port.out.ResponseCache;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-memory cache with per-entry time-to-live and least-recently-used eviction.
 * All reads and writes go through one reentrant lock. The backing map keeps the
 * most recently used entry at the tail, so iteration order is eviction order.
 */
public class LruTtlCache<V> implements ResponseCache<V> {

    private static final Logger logger = LoggerFactory.getLogger(LruTtlCache.class);

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;
    private final SizeEstimator sizeEstimator;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public LruTtlCache(String name, int maxSize, Duration defaultTtl, SizeEstimator sizeEstimator, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.sizeEstimator = sizeEstimator;
        this.clock = clock;
    }

    @Override
    public Optional<V> get(String key) {
        return getEntry(key).map(CacheEntry::value);
    }

    /**
     * Same hit/miss accounting as {@link #get(String)} but exposes the entry metadata,
     * which lets a faster tier inherit the remaining lifetime on promotion.
     */
    public Optional<CacheEntry<V>> getEntry(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (!entry.isLive(clock.instant())) {
                entries.remove(key);
                expirations++;
                misses++;
                logger.debug("[{}] Expired entry dropped on read: {}", name, key);
                return Optional.empty();
            }
            entries.remove(key);
            entries.put(key, entry);
            entry.recordHit();
            hits++;
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Turn the last miss into a hit, for a lookup that missed here but was served from the
     * store this cache indexes
     */
    public void recordBackingStoreHit() {
        lock.lock();
        try {
            if (misses > 0) {
                misses--;
            }
            hits++;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, V value) {
        set(key, value, null);
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;

        // Serialization happens before taking the lock
        long size = sizeEstimator.estimate(value);

        lock.lock();
        try {
            CacheEntry<V> entry = new CacheEntry<>(value, clock.instant(), effectiveTtl, size);
            // Remove first so an overwrite is re-inserted at the most-recent position
            entries.remove(key);
            entries.put(key, entry);
            evictIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop a single key without touching the counters
     */
    public boolean invalidate(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
            evictions = 0;
            expirations = 0;
            logger.debug("[{}] Cleared", name);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks membership without counting a hit or refreshing recency
     */
    public boolean containsLive(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            return entry != null && entry.isLive(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            long totalBytes = 0;
            for (CacheEntry<V> entry : entries.values()) {
                totalBytes += entry.sizeBytes();
            }
            return new CacheStats(hits, misses, evictions, expirations, entries.size(), maxSize, totalBytes);
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    public int maxSize() {
        return maxSize;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    // Caller holds the lock
    private void evictIfNeeded() {
        purgeExpired();

        Iterator<Map.Entry<String, CacheEntry<V>>> eldest = entries.entrySet().iterator();
        while (entries.size() > maxSize && eldest.hasNext()) {
            String evictedKey = eldest.next().getKey();
            eldest.remove();
            evictions++;
            logger.debug("[{}] Evicted least recently used entry: {}", name, evictedKey);
        }
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        Iterator<CacheEntry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (!it.next().isLive(now)) {
                it.remove();
                expirations++;
            }
        }
    }
}
