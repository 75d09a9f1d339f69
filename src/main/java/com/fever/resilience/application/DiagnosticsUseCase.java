package com.fever.resilience.application;

import com.fever.resilience.domain.model.SystemHealth;
import com.fever.resilience.infrastructure.cache.LruTtlCache;
import com.fever.resilience.infrastructure.cache.TieredCache;
import com.fever.resilience.infrastructure.monitor.PerformanceMonitor;
import com.fever.resilience.infrastructure.pool.ConnectionPool;
import com.fever.resilience.infrastructure.resilience.ResilienceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DiagnosticsUseCase implements SystemDiagnostics {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsUseCase.class);

    private final ResilienceRegistry registry;
    private final LruTtlCache<Object> memoryCache;
    private final TieredCache<Object> tieredCache;
    private final ConnectionPool connectionPool;
    private final PerformanceMonitor performanceMonitor;

    public DiagnosticsUseCase(ResilienceRegistry registry,
                              LruTtlCache<Object> memoryCache,
                              TieredCache<Object> tieredCache,
                              ConnectionPool connectionPool,
                              PerformanceMonitor performanceMonitor) {
        this.registry = registry;
        this.memoryCache = memoryCache;
        this.tieredCache = tieredCache;
        this.connectionPool = connectionPool;
        this.performanceMonitor = performanceMonitor;
    }

    @Override
    public SystemHealth systemHealth() {
        SystemHealth health = registry.getSystemHealth();
        logger.debug("System health: {} ({} recent errors)", health.overallHealth(), health.recentErrors());
        return health;
    }

    @Override
    public PerformanceReport performanceReport() {
        return new PerformanceReport(
                memoryCache.getStats(),
                tieredCache.getStats(),
                connectionPool.getStats(),
                performanceMonitor.getMetrics()
        );
    }

    @Override
    public void clearCaches() {
        memoryCache.clear();
        tieredCache.clear();
        logger.info("All caches cleared");
    }
}
