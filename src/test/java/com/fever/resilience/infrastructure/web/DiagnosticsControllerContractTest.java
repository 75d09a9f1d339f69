package com.fever.resilience.infrastructure.web;

import com.fever.resilience.application.PerformanceReport;
import com.fever.resilience.application.SystemDiagnostics;
import com.fever.resilience.domain.model.CircuitState;
import com.fever.resilience.domain.model.SystemHealth;
import com.fever.resilience.infrastructure.cache.CacheStats;
import com.fever.resilience.infrastructure.cache.TieredCacheStats;
import com.fever.resilience.infrastructure.pool.PoolStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DiagnosticsController.class)
class DiagnosticsControllerContractTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SystemDiagnostics diagnostics;

    @Test
    void shouldReturnHealthInSnakeCase() throws Exception {
        // Given
        when(diagnostics.systemHealth()).thenReturn(new SystemHealth(
                SystemHealth.DEGRADED, 1.5,
                Map.of("llm", "degraded: connection refused"),
                Map.of("llm", CircuitState.OPEN),
                90, 95));

        // When & Then
        mockMvc.perform(get("/diagnostics/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall_health", is("degraded")))
                .andExpect(jsonPath("$.error_rate_per_minute", is(1.5)))
                .andExpect(jsonPath("$.service_health.llm", is("degraded: connection refused")))
                .andExpect(jsonPath("$.circuit_breaker_status.llm", is("OPEN")))
                .andExpect(jsonPath("$.recent_errors", is(90)))
                .andExpect(jsonPath("$.total_errors", is(95)));
    }

    @Test
    void shouldReturnServiceUnavailableWhenCritical() throws Exception {
        // Given
        when(diagnostics.systemHealth()).thenReturn(new SystemHealth(
                SystemHealth.CRITICAL, 7.0, Map.of(), Map.of(), 420, 420));

        // When & Then
        mockMvc.perform(get("/diagnostics/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.overall_health", is("critical")));
    }

    @Test
    void shouldReturnPerformanceReport() throws Exception {
        // Given
        CacheStats memory = new CacheStats(3, 1, 0, 0, 2, 500, 64);
        when(diagnostics.performanceReport()).thenReturn(new PerformanceReport(
                memory,
                TieredCacheStats.blend(memory, CacheStats.empty(1000), 0.7, 0.3),
                new PoolStats(2, 5),
                Map.of()));

        // When & Then
        mockMvc.perform(get("/diagnostics/performance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memory_cache.hits", is(3)))
                .andExpect(jsonPath("$.memory_cache.max_size", is(500)))
                .andExpect(jsonPath("$.memory_cache.hit_rate", is(0.75)))
                .andExpect(jsonPath("$.tiered_cache.disk_cache.max_size", is(1000)))
                .andExpect(jsonPath("$.tiered_cache.total_hit_rate", closeTo(0.525, 1e-9)))
                .andExpect(jsonPath("$.connection_pool.available_connections", is(3)))
                .andExpect(jsonPath("$.performance_metrics").isMap());
    }

    @Test
    void shouldClearCaches() throws Exception {
        // When & Then
        mockMvc.perform(post("/diagnostics/cache/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared", is(true)));
        verify(diagnostics).clearCaches();
    }

    @Test
    void shouldReportFailureToClearCaches() throws Exception {
        // Given
        doThrow(new IllegalStateException("cache directory is read-only")).when(diagnostics).clearCaches();

        // When & Then
        mockMvc.perform(post("/diagnostics/cache/clear"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.cleared", is(false)))
                .andExpect(jsonPath("$.error", is("cache directory is read-only")));
    }
}
