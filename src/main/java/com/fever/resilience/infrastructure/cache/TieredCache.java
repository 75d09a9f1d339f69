package com.fever.resilience.infrastructure.cache;

import com.fever.resilience.domain.port.out.ResponseCache;
import com.fever.resilience.infrastructure.cache.disk.DiskCacheStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-tier cache: a small fast memory tier in front of a larger persistent tier.
 * The persistent tier is an in-memory index plus one file per key on disk. Writes go
 * through to every level; reads fall through memory, index, then disk, and a hit in a
 * slower level is promoted into the faster ones with its remaining lifetime. A hit on a
 * file the index no longer knows about counts as a disk tier hit.
 *
 * Holds no lock of its own: each index guards itself and disk I/O runs outside them.
 */
public class TieredCache<V> implements ResponseCache<V> {

    private static final Logger logger = LoggerFactory.getLogger(TieredCache.class);

    private final LruTtlCache<V> memoryTier;
    private final LruTtlCache<V> diskIndex;
    private final DiskCacheStore diskStore;
    private final Class<V> valueType;
    private final Duration defaultTtl;
    private final double memoryWeight;
    private final double diskWeight;
    private final Clock clock;

    public TieredCache(LruTtlCache<V> memoryTier,
                       LruTtlCache<V> diskIndex,
                       DiskCacheStore diskStore,
                       Class<V> valueType,
                       Duration defaultTtl,
                       double memoryWeight,
                       double diskWeight,
                       Clock clock) {
        this.memoryTier = memoryTier;
        this.diskIndex = diskIndex;
        this.diskStore = diskStore;
        this.valueType = valueType;
        this.defaultTtl = defaultTtl;
        this.memoryWeight = memoryWeight;
        this.diskWeight = diskWeight;
        this.clock = clock;
    }

    @Override
    public Optional<V> get(String key) {
        Optional<V> fromMemory = memoryTier.get(key);
        if (fromMemory.isPresent()) {
            logger.debug("Memory tier hit: {}", key);
            return fromMemory;
        }

        Optional<CacheEntry<V>> indexed = diskIndex.getEntry(key);
        if (indexed.isPresent()) {
            CacheEntry<V> entry = indexed.get();
            promote(memoryTier, key, entry.value(), entry.remaining(clock.instant()));
            logger.debug("Disk index hit, promoted to memory: {}", key);
            return Optional.of(entry.value());
        }

        return diskStore.read(key, valueType).map(stored -> {
            diskIndex.recordBackingStoreHit();
            Duration remaining = stored.remaining(clock.instant());
            promote(memoryTier, key, stored.value(), remaining);
            promote(diskIndex, key, stored.value(), remaining);
            logger.debug("Disk file hit, promoted to both tiers: {}", key);
            return stored.value();
        });
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
        Instant now = clock.instant();

        memoryTier.set(key, value, effectiveTtl);
        diskIndex.set(key, value, effectiveTtl);
        diskStore.write(key, value, now, effectiveTtl);
    }

    /**
     * Remove one key from every level
     */
    public void invalidate(String key) {
        memoryTier.invalidate(key);
        diskIndex.invalidate(key);
        diskStore.delete(key);
    }

    @Override
    public void clear() {
        memoryTier.clear();
        diskIndex.clear();
        int removed = diskStore.clear();
        logger.info("Cleared tiered cache, removed {} disk files", removed);
    }

    /**
     * @return number of stale files deleted from the cache directory
     */
    public int removeStaleFiles(Duration maxAge) {
        return diskStore.removeFilesOlderThan(maxAge);
    }

    public boolean isInMemoryTier(String key) {
        return memoryTier.containsLive(key);
    }

    public TieredCacheStats getStats() {
        return TieredCacheStats.blend(memoryTier.getStats(), diskIndex.getStats(), memoryWeight, diskWeight);
    }

    // A zero ttl means the tier default, so an entry with no lifetime left stays where it is
    private void promote(LruTtlCache<V> tier, String key, V value, Duration remaining) {
        if (!remaining.isZero()) {
            tier.set(key, value, remaining);
        }
    }
}
