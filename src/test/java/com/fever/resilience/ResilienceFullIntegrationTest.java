package com.fever.resilience;

import com.fever.resilience.application.CachePolicy;
import com.fever.resilience.application.CallComposer;
import com.fever.resilience.domain.port.out.RemoteCall;
import com.fever.resilience.infrastructure.cron.CacheMaintenanceJob;
import com.fever.resilience.infrastructure.resilience.RetryPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = ResilienceApplication.class)
@TestPropertySource(properties = {
        "resilience.cache.directory=target/integration-cache",
        "resilience.maintenance.enabled=false",
        "resilience.breaker.failure-threshold=2"
})
class ResilienceFullIntegrationTest {

    @Autowired
    private WebApplicationContext webApplicationContext;

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private CallComposer composer;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        mockMvc = MockMvcBuilders.webAppContextSetup(webApplicationContext).build();
        mockMvc.perform(post("/diagnostics/cache/clear")).andExpect(status().isOk());
    }

    @Test
    void shouldNotStartMaintenanceJobWhenDisabled() {
        assertThat(applicationContext.getBeansOfType(CacheMaintenanceJob.class)).isEmpty();
    }

    @Test
    void shouldShareOneSystemClock() {
        assertThat(applicationContext.getBeansOfType(Clock.class)).containsOnlyKeys("clock");
        assertThat(applicationContext.getBean(Clock.class).getZone()).isEqualTo(Clock.systemUTC().getZone());
    }

    @Test
    void shouldServeCachedResultsAndReportHits() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        RemoteCall<String, String> lookup = composer.timed("lookup",
                composer.cached("lookup", String.class,
                        composer.pooled((String input) -> "result for " + input + " #" + invocations.incrementAndGet()),
                        CachePolicy.memory(Duration.ofMinutes(5))));

        // When
        String first = lookup.call("fever");
        String second = lookup.call("fever");

        // Then
        assertThat(second).isEqualTo(first);
        assertThat(invocations).hasValue(1);
        mockMvc.perform(get("/diagnostics/performance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memory_cache.hits", is(1)))
                .andExpect(jsonPath("$.memory_cache.misses", is(1)))
                .andExpect(jsonPath("$.memory_cache.current_size", is(1)))
                .andExpect(jsonPath("$.connection_pool.max_connections", is(5)))
                .andExpect(jsonPath("$.performance_metrics.lookup").exists());
    }

    @Test
    void shouldPersistDiskLevelResultsAndClearThemOnRequest() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        RemoteCall<String, String> models = composer.cached("models", String.class,
                input -> "models #" + invocations.incrementAndGet(), CachePolicy.disk(Duration.ofHours(1)));
        models.call("list");

        // When
        mockMvc.perform(post("/diagnostics/cache/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared", is(true)));
        String afterClear = models.call("list");

        // Then
        assertThat(afterClear).isEqualTo("models #2");
    }

    @Test
    void shouldDegradeOpenBreakerAndExposeItInHealth() throws Exception {
        // Given
        RemoteCall<String, String> unreachable = input -> {
            throw new IOException("network unreachable");
        };
        RemoteCall<String, String> guarded = composer.withGracefulDegradation("web_search", null,
                composer.withCircuitBreaker("web_search",
                        composer.retrying("web_search", unreachable, RetryPolicy.noRetry())));

        // When
        String first = guarded.call("query");
        guarded.call("query");

        // Then
        assertThat(first).startsWith("[Web Search Unavailable]");
        mockMvc.perform(get("/diagnostics/health"))
                .andExpect(jsonPath("$.overall_health", is("healthy")))
                .andExpect(jsonPath("$.error_rate_per_minute", lessThan(1.0)))
                .andExpect(jsonPath("$.circuit_breaker_status.web_search", is("OPEN")))
                .andExpect(jsonPath("$.service_health.web_search", startsWith("degraded: ")))
                .andExpect(jsonPath("$.total_errors", greaterThanOrEqualTo(2)));
        assertThat(circuitBreakerRegistry.find("web_search"))
                .map(CircuitBreaker::getState)
                .hasValue(CircuitBreaker.State.OPEN);
    }
}
