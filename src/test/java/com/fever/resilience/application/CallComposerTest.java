package com.fever.resilience.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fever.resilience.domain.model.CircuitState;
import com.fever.resilience.domain.port.out.RemoteCall;
import com.fever.resilience.infrastructure.cache.LruTtlCache;
import com.fever.resilience.infrastructure.cache.SizeEstimator;
import com.fever.resilience.infrastructure.cache.TieredCache;
import com.fever.resilience.infrastructure.cache.disk.DiskCacheStore;
import com.fever.resilience.infrastructure.monitor.PerformanceMonitor;
import com.fever.resilience.infrastructure.pool.ConnectionPool;
import com.fever.resilience.infrastructure.resilience.ErrorClassifier;
import com.fever.resilience.infrastructure.resilience.ErrorHistory;
import com.fever.resilience.infrastructure.resilience.GracefulDegradation;
import com.fever.resilience.infrastructure.resilience.HealthThresholds;
import com.fever.resilience.infrastructure.resilience.ResilienceRegistry;
import com.fever.resilience.infrastructure.resilience.RetryPolicy;
import com.fever.resilience.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class CallComposerTest {

    record Forecast(String city, int degrees) {}

    @TempDir
    Path cacheDir;

    private MutableClock clock;
    private ObjectMapper objectMapper;
    private SizeEstimator sizeEstimator;
    private ConnectionPool pool;
    private PerformanceMonitor monitor;
    private ResilienceRegistry registry;
    private CallComposer composer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-12-01T10:00:00Z");
        objectMapper = new ObjectMapper();
        sizeEstimator = new SizeEstimator(objectMapper);
        pool = new ConnectionPool(2, Duration.ofSeconds(5));
        monitor = new PerformanceMonitor(clock);
        ErrorClassifier classifier = new ErrorClassifier(clock);
        ErrorHistory history = new ErrorHistory(100, clock);
        registry = new ResilienceRegistry(2, Duration.ofSeconds(60),
                new RetryPolicy(2, Duration.ofMillis(10), Duration.ofSeconds(1), 2.0, false),
                HealthThresholds.defaults(), classifier, history,
                new GracefulDegradation(classifier, history, clock),
                duration -> {
                },
                clock);
        composer = newComposer();
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private CallComposer newComposer() {
        LruTtlCache<Object> memory = new LruTtlCache<>("memory", 10, Duration.ofMinutes(30), sizeEstimator, clock);
        TieredCache<Object> tiered = new TieredCache<>(
                new LruTtlCache<>("tier-memory", 10, Duration.ofMinutes(30), sizeEstimator, clock),
                new LruTtlCache<>("tier-disk", 100, Duration.ofHours(24), sizeEstimator, clock),
                new DiskCacheStore(cacheDir, objectMapper, clock),
                Object.class, Duration.ofHours(1), 0.7, 0.3, clock);
        return new CallComposer(memory, tiered, pool, monitor, registry, objectMapper);
    }

    @Test
    void shouldServeRepeatedInputFromCache() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        RemoteCall<String, String> cached = composer.cached("complete", String.class,
                input -> "answer " + invocations.incrementAndGet(), CachePolicy.memory(Duration.ofMinutes(5)));

        // When
        String first = cached.call("question");
        String second = cached.call("question");
        String other = cached.call("another question");

        // Then
        assertThat(first).isEqualTo("answer 1");
        assertThat(second).isEqualTo("answer 1");
        assertThat(other).isEqualTo("answer 2");
        assertThat(invocations).hasValue(2);
    }

    @Test
    void shouldExpireCachedResultAfterTtl() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        RemoteCall<String, Integer> cached = composer.cached("count", Integer.class,
                input -> invocations.incrementAndGet(), CachePolicy.memory(Duration.ofSeconds(10)));
        cached.call("x");

        // When
        clock.advance(Duration.ofSeconds(10));
        Integer result = cached.call("x");

        // Then
        assertThat(result).isEqualTo(2);
    }

    @Test
    void shouldNotCacheFailuresOrNullResults() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        RemoteCall<String, String> flaky = composer.cached("flaky", String.class, input -> {
            int n = invocations.incrementAndGet();
            if (n == 1) {
                throw new IOException("timeout");
            }
            return n == 2 ? null : "value";
        }, CachePolicy.memory(null));

        // When
        assertThatThrownBy(() -> flaky.call("k")).isInstanceOf(IOException.class);
        String second = flaky.call("k");
        String third = flaky.call("k");
        String fourth = flaky.call("k");

        // Then
        assertThat(second).isNull();
        assertThat(third).isEqualTo("value");
        assertThat(fourth).isEqualTo("value");
        assertThat(invocations).hasValue(3);
    }

    @Test
    void shouldRebuildTypedResultReadBackFromDisk() throws Exception {
        // Given
        composer.cached("forecast", Forecast.class, (String city) -> new Forecast(city, 21),
                CachePolicy.disk(Duration.ofHours(1))).call("Madrid");
        CallComposer afterRestart = newComposer();
        AtomicInteger invocations = new AtomicInteger();

        // When
        Forecast forecast = afterRestart.cached("forecast", Forecast.class, (String city) -> {
            invocations.incrementAndGet();
            return new Forecast(city, -1);
        }, CachePolicy.disk(Duration.ofHours(1))).call("Madrid");

        // Then
        assertThat(forecast).isEqualTo(new Forecast("Madrid", 21));
        assertThat(invocations).hasValue(0);
    }

    @Test
    void shouldRunPooledCallOnWorkerThread() throws Exception {
        // Given
        AtomicReference<String> threadName = new AtomicReference<>();

        // When
        String result = composer.pooled((String input) -> {
            threadName.set(Thread.currentThread().getName());
            return input;
        }).call("ping");

        // Then
        assertThat(result).isEqualTo("ping");
        assertThat(threadName.get()).startsWith("remote-call-");
    }

    @Test
    void shouldRecordTimedCalls() throws Exception {
        // When
        composer.timed("echo", (String input) -> input).call("x");

        // Then
        assertThat(monitor.getOperationStats("echo")).hasValueSatisfying(
                metrics -> assertThat(metrics.callCount()).isEqualTo(1));
    }

    @Test
    void shouldRetryThroughRegistryController() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        RemoteCall<String, String> retrying = composer.retrying("search", input -> {
            if (invocations.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "found " + input;
        });

        // When
        String result = retrying.call("java");

        // Then
        assertThat(result).isEqualTo("found java");
        assertThat(invocations).hasValue(3);
    }

    @Test
    void shouldComposeDegradationOverBreakerOverRetry() throws Exception {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        RemoteCall<String, String> unreliable = input -> {
            invocations.incrementAndGet();
            throw new IOException("Connection refused");
        };
        composer.registerFallback("local_llm", (RemoteCall<String, String>) input -> "local: " + input);
        RemoteCall<String, String> guarded = composer.withGracefulDegradation("llm", "local_llm",
                composer.withCircuitBreaker("llm",
                        composer.retrying("llm", unreliable, RetryPolicy.noRetry())));

        // When
        String first = guarded.call("hello");
        String second = guarded.call("hello");
        String third = guarded.call("hello");

        // Then
        assertThat(first).isEqualTo("local: hello");
        assertThat(second).isEqualTo("local: hello");
        assertThat(third).isEqualTo("local: hello");
        assertThat(invocations).hasValue(2);
        assertThat(registry.circuitBreakerStatus()).containsEntry("llm", CircuitState.OPEN);
        assertThat(registry.degradation().getServiceHealth().get("llm"))
                .startsWith(GracefulDegradation.DEGRADED_PREFIX)
                .contains("Circuit breaker is OPEN");
    }

    @Test
    void shouldReturnDegradedMessageWithoutFallback() throws Exception {
        // Given
        RemoteCall<String, String> guarded = composer.withGracefulDegradation("code_generation", null,
                input -> {
                    throw new IllegalStateException("model crashed");
                });

        // When
        String result = guarded.call("write a parser");

        // Then
        assertThat(result).startsWith("[Code Generation Limited]");
    }
}
