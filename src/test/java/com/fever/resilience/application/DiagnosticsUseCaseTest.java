package com.fever.resilience.application;

import com.fever.resilience.domain.model.OperationMetrics;
import com.fever.resilience.domain.model.SystemHealth;
import com.fever.resilience.infrastructure.cache.CacheStats;
import com.fever.resilience.infrastructure.cache.LruTtlCache;
import com.fever.resilience.infrastructure.cache.TieredCache;
import com.fever.resilience.infrastructure.cache.TieredCacheStats;
import com.fever.resilience.infrastructure.monitor.PerformanceMonitor;
import com.fever.resilience.infrastructure.pool.ConnectionPool;
import com.fever.resilience.infrastructure.pool.PoolStats;
import com.fever.resilience.infrastructure.resilience.ResilienceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DiagnosticsUseCaseTest {

    @Mock
    private ResilienceRegistry registry;

    @Mock
    private LruTtlCache<Object> memoryCache;

    @Mock
    private TieredCache<Object> tieredCache;

    @Mock
    private ConnectionPool connectionPool;

    @Mock
    private PerformanceMonitor performanceMonitor;

    private DiagnosticsUseCase diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsUseCase(registry, memoryCache, tieredCache, connectionPool, performanceMonitor);
    }

    @Test
    void shouldDelegateSystemHealthToRegistry() {
        // Given
        SystemHealth health = new SystemHealth(SystemHealth.DEGRADED, 2.0, Map.of(), Map.of(), 120, 150);
        when(registry.getSystemHealth()).thenReturn(health);

        // When
        SystemHealth result = diagnostics.systemHealth();

        // Then
        assertThat(result).isSameAs(health);
    }

    @Test
    void shouldAggregatePerformanceReport() {
        // Given
        CacheStats memory = new CacheStats(8, 2, 1, 0, 10, 500, 2048);
        TieredCacheStats tiered = TieredCacheStats.blend(CacheStats.empty(100), CacheStats.empty(1000), 0.7, 0.3);
        PoolStats pool = new PoolStats(1, 5);
        OperationMetrics llm = new OperationMetrics(Duration.ofSeconds(3), 3, 3, 0,
                Duration.ofMillis(500), Duration.ofMillis(1500), Duration.ofSeconds(1));
        when(memoryCache.getStats()).thenReturn(memory);
        when(tieredCache.getStats()).thenReturn(tiered);
        when(connectionPool.getStats()).thenReturn(pool);
        when(performanceMonitor.getMetrics()).thenReturn(Map.of("llm", llm));

        // When
        PerformanceReport report = diagnostics.performanceReport();

        // Then
        assertThat(report.memoryCache().hitRate()).isEqualTo(0.8);
        assertThat(report.tieredCache()).isEqualTo(tiered);
        assertThat(report.connectionPool().availableConnections()).isEqualTo(4);
        assertThat(report.performanceMetrics()).containsEntry("llm", llm);
    }

    @Test
    void shouldClearBothCaches() {
        // When
        diagnostics.clearCaches();

        // Then
        verify(memoryCache).clear();
        verify(tieredCache).clear();
        verifyNoInteractions(registry, connectionPool, performanceMonitor);
    }
}
