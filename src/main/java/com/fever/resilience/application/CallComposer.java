package com.fever.resilience.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fever.resilience.domain.port.out.RemoteCall;
import com.fever.resilience.domain.port.out.ResponseCache;
import com.fever.resilience.infrastructure.cache.CacheKeys;
import com.fever.resilience.infrastructure.cache.LruTtlCache;
import com.fever.resilience.infrastructure.cache.TieredCache;
import com.fever.resilience.infrastructure.monitor.PerformanceMonitor;
import com.fever.resilience.infrastructure.pool.ConnectionPool;
import com.fever.resilience.infrastructure.resilience.RetryPolicy;
import com.fever.resilience.infrastructure.resilience.ResilienceRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Composable wrappers around remote calls.
 * Each method takes a call plus its configuration and returns a call with the same contract,
 * so callers decide the nesting order explicitly, e.g.
 *
 * <pre>{@code
 * RemoteCall<String, String> guarded = composer.withGracefulDegradation("llm", "local-model",
 *         composer.withCircuitBreaker("llm",
 *                 composer.retrying("llm",
 *                         composer.cached("complete", String.class, client::complete,
 *                                 CachePolicy.memory(Duration.ofMinutes(5))))));
 * }</pre>
 */
@Service
public class CallComposer {

    private static final Logger logger = LoggerFactory.getLogger(CallComposer.class);

    private final LruTtlCache<Object> memoryCache;
    private final TieredCache<Object> tieredCache;
    private final ConnectionPool connectionPool;
    private final PerformanceMonitor performanceMonitor;
    private final ResilienceRegistry registry;
    private final ObjectMapper objectMapper;

    public CallComposer(LruTtlCache<Object> memoryCache,
                        TieredCache<Object> tieredCache,
                        ConnectionPool connectionPool,
                        PerformanceMonitor performanceMonitor,
                        ResilienceRegistry registry,
                        ObjectMapper objectMapper) {
        this.memoryCache = memoryCache;
        this.tieredCache = tieredCache;
        this.connectionPool = connectionPool;
        this.performanceMonitor = performanceMonitor;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    /**
     * Serve repeated inputs from cache. Failures and null results are not cached.
     *
     * @param resultType used to rebuild values that were read back from disk
     */
    public <I, O> RemoteCall<I, O> cached(String operationName, Class<O> resultType,
                                          RemoteCall<I, O> call, CachePolicy policy) {
        ResponseCache<Object> cache = policy.level() == CacheLevel.DISK ? tieredCache : memoryCache;
        return input -> {
            String key = CacheKeys.forCall(operationName, input);

            Optional<O> cached = cache.get(key).flatMap(value -> coerce(value, resultType));
            if (cached.isPresent()) {
                logger.debug("Cache hit for {}", operationName);
                return cached.get();
            }

            O result = call.call(input);
            if (result != null) {
                cache.set(key, result, policy.ttl());
                logger.debug("Cache miss for {}, result cached", operationName);
            }
            return result;
        };
    }

    /**
     * Run the call on the bounded worker pool, subject to the pool timeout
     */
    public <I, O> RemoteCall<I, O> pooled(RemoteCall<I, O> call) {
        return connectionPool.decorate(call);
    }

    /**
     * Record duration and outcome of every invocation under {@code operationName}
     */
    public <I, O> RemoteCall<I, O> timed(String operationName, RemoteCall<I, O> call) {
        return performanceMonitor.timed(operationName, call);
    }

    public <I, O> RemoteCall<I, O> retrying(String serviceName, RemoteCall<I, O> call) {
        return registry.retryController(serviceName).decorate(call);
    }

    public <I, O> RemoteCall<I, O> retrying(String serviceName, RemoteCall<I, O> call, RetryPolicy policy) {
        return registry.retryController(serviceName, policy).decorate(call);
    }

    public <I, O> RemoteCall<I, O> withCircuitBreaker(String serviceName, RemoteCall<I, O> call) {
        return registry.circuitBreaker(serviceName).decorate(call);
    }

    /**
     * Outermost layer: never throws, answers with the fallback or a degraded message instead
     */
    public <I> RemoteCall<I, String> withGracefulDegradation(String serviceName, String fallbackKey,
                                                             RemoteCall<I, String> call) {
        return registry.degradation().decorate(serviceName, fallbackKey, call);
    }

    public <I, O> void registerFallback(String fallbackKey, RemoteCall<I, O> fallback) {
        registry.degradation().registerFallback(fallbackKey, fallback);
    }

    private <O> Optional<O> coerce(Object value, Class<O> resultType) {
        if (resultType.isInstance(value)) {
            return Optional.of(resultType.cast(value));
        }
        try {
            return Optional.of(objectMapper.convertValue(value, resultType));
        } catch (IllegalArgumentException e) {
            logger.warn("Cached value is not a {}, ignoring it: {}", resultType.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }
}
