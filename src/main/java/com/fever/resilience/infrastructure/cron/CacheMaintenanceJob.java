package com.fever.resilience.infrastructure.cron;

import com.fever.resilience.infrastructure.cache.CacheStats;
import com.fever.resilience.infrastructure.cache.LruTtlCache;
import com.fever.resilience.infrastructure.cache.TieredCache;
import com.fever.resilience.infrastructure.config.CacheProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic housekeeping: drops stale disk files and relieves memory pressure
 */
@Service
@ConditionalOnProperty(name = "resilience.maintenance.enabled", havingValue = "true", matchIfMissing = true)
public class CacheMaintenanceJob {

    private static final Logger logger = LoggerFactory.getLogger(CacheMaintenanceJob.class);

    private final LruTtlCache<Object> memoryCache;
    private final TieredCache<Object> tieredCache;
    private final CacheProperties properties;

    public CacheMaintenanceJob(LruTtlCache<Object> memoryCache,
                               TieredCache<Object> tieredCache,
                               CacheProperties properties) {
        this.memoryCache = memoryCache;
        this.tieredCache = tieredCache;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${resilience.maintenance.interval-ms:3600000}",
            initialDelayString = "${resilience.maintenance.interval-ms:3600000}")
    public void run() {
        logger.info("Running cache maintenance");
        cleanupOldFiles();
        relieveMemoryPressure();
    }

    public int cleanupOldFiles() {
        int removed = tieredCache.removeStaleFiles(properties.getStaleFileAge());
        if (removed > 0) {
            logger.info("Removed {} cache files older than {}", removed, properties.getStaleFileAge());
        }
        return removed;
    }

    /**
     * @return true when the memory cache was over budget and got cleared
     */
    public boolean relieveMemoryPressure() {
        CacheStats stats = memoryCache.getStats();
        if (stats.totalSizeBytes() > properties.getMaxMemoryBytes()) {
            logger.info("Clearing memory cache to free up space ({} bytes over {} limit)",
                    stats.totalSizeBytes(), properties.getMaxMemoryBytes());
            memoryCache.clear();
            return true;
        }
        return false;
    }
}
