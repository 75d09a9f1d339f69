package com.fever.resilience.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fever.resilience.infrastructure.cache.LruTtlCache;
import com.fever.resilience.infrastructure.cache.SizeEstimator;
import com.fever.resilience.infrastructure.cache.TieredCache;
import com.fever.resilience.infrastructure.cache.disk.DiskCacheStore;
import com.fever.resilience.infrastructure.monitor.PerformanceMonitor;
import com.fever.resilience.infrastructure.pool.ConnectionPool;
import com.fever.resilience.infrastructure.resilience.ErrorClassifier;
import com.fever.resilience.infrastructure.resilience.ErrorHistory;
import com.fever.resilience.infrastructure.resilience.GracefulDegradation;
import com.fever.resilience.infrastructure.resilience.ResilienceRegistry;
import com.fever.resilience.infrastructure.resilience.Sleeper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One shared instance of every cache and resilience component per application context
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SizeEstimator sizeEstimator(ObjectMapper objectMapper) {
        return new SizeEstimator(objectMapper);
    }

    @Bean
    public LruTtlCache<Object> memoryCache(CacheProperties props, SizeEstimator sizeEstimator, Clock clock) {
        return new LruTtlCache<>("memory", props.getMemoryMaxSize(), props.getMemoryDefaultTtl(), sizeEstimator, clock);
    }

    @Bean
    public DiskCacheStore diskCacheStore(CacheProperties props, ObjectMapper objectMapper, Clock clock) {
        return new DiskCacheStore(Path.of(props.getDirectory()), objectMapper, clock);
    }

    @Bean
    public TieredCache<Object> tieredCache(CacheProperties props, SizeEstimator sizeEstimator,
                                           DiskCacheStore diskCacheStore, Clock clock) {
        LruTtlCache<Object> memoryTier = new LruTtlCache<>("tier-memory",
                props.getTierMemorySize(), props.getTierMemoryTtl(), sizeEstimator, clock);
        LruTtlCache<Object> diskIndex = new LruTtlCache<>("tier-disk",
                props.getDiskIndexSize(), props.getDiskIndexTtl(), sizeEstimator, clock);
        return new TieredCache<>(memoryTier, diskIndex, diskCacheStore, Object.class,
                props.getTierDefaultTtl(), props.getMemoryWeight(), props.getDiskWeight(), clock);
    }

    @Bean(destroyMethod = "close")
    public ConnectionPool connectionPool(ResilienceProperties props) {
        return new ConnectionPool(props.getPool().getMaxConnections(), props.getPool().getTimeout());
    }

    @Bean
    public PerformanceMonitor performanceMonitor(Clock clock) {
        return new PerformanceMonitor(clock);
    }

    @Bean
    public ErrorClassifier errorClassifier(Clock clock) {
        return new ErrorClassifier(clock);
    }

    @Bean
    public ErrorHistory errorHistory(ResilienceProperties props, Clock clock) {
        return new ErrorHistory(props.getHealth().getHistorySize(), clock);
    }

    @Bean
    public GracefulDegradation gracefulDegradation(ErrorClassifier errorClassifier, ErrorHistory errorHistory,
                                                   Clock clock) {
        return new GracefulDegradation(errorClassifier, errorHistory, clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public ResilienceRegistry resilienceRegistry(CircuitBreakerRegistry circuitBreakerRegistry,
                                                 RetryRegistry retryRegistry,
                                                 ResilienceProperties props,
                                                 ErrorClassifier errorClassifier,
                                                 ErrorHistory errorHistory,
                                                 GracefulDegradation gracefulDegradation,
                                                 Clock clock) {
        return new ResilienceRegistry(
                circuitBreakerRegistry,
                retryRegistry,
                props.getBreaker().getFailureThreshold(),
                props.getBreaker().getRecoveryTimeout(),
                props.getRetry().toPolicy(),
                props.getHealth().toThresholds(),
                errorClassifier,
                errorHistory,
                gracefulDegradation,
                Sleeper.THREAD,
                clock
        );
    }
}
