package com.fever.resilience.infrastructure.resilience;

import com.fever.resilience.domain.model.CircuitState;
import com.fever.resilience.domain.model.ErrorContext;
import com.fever.resilience.domain.model.ErrorRecord;
import com.fever.resilience.domain.model.SystemHealth;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the named breakers and retry controllers, the degradation router and the error
 * history, and derives the overall system health from them.
 * Breakers and retry controllers are created on first use and reused afterwards; their
 * resilience4j delegates live in the shared {@link CircuitBreakerRegistry} and {@link RetryRegistry}.
 */
public class ResilienceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceRegistry.class);

    private final ConcurrentMap<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RetryController> retryControllers = new ConcurrentHashMap<>();
    private final DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;

    private final int defaultFailureThreshold;
    private final Duration defaultRecoveryTimeout;
    private final RetryPolicy defaultRetryPolicy;
    private final HealthThresholds healthThresholds;
    private final ErrorClassifier errorClassifier;
    private final ErrorHistory errorHistory;
    private final GracefulDegradation degradation;
    private final Sleeper sleeper;
    private final Clock clock;

    public ResilienceRegistry(int defaultFailureThreshold,
                              Duration defaultRecoveryTimeout,
                              RetryPolicy defaultRetryPolicy,
                              HealthThresholds healthThresholds,
                              ErrorClassifier errorClassifier,
                              ErrorHistory errorHistory,
                              GracefulDegradation degradation,
                              Sleeper sleeper,
                              Clock clock) {
        this(CircuitBreakerRegistry.ofDefaults(), RetryRegistry.ofDefaults(), defaultFailureThreshold,
                defaultRecoveryTimeout, defaultRetryPolicy, healthThresholds, errorClassifier, errorHistory,
                degradation, sleeper, clock);
    }

    public ResilienceRegistry(CircuitBreakerRegistry circuitBreakerRegistry,
                              RetryRegistry retryRegistry,
                              int defaultFailureThreshold,
                              Duration defaultRecoveryTimeout,
                              RetryPolicy defaultRetryPolicy,
                              HealthThresholds healthThresholds,
                              ErrorClassifier errorClassifier,
                              ErrorHistory errorHistory,
                              GracefulDegradation degradation,
                              Sleeper sleeper,
                              Clock clock) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
        this.defaultFailureThreshold = defaultFailureThreshold;
        this.defaultRecoveryTimeout = defaultRecoveryTimeout;
        this.defaultRetryPolicy = defaultRetryPolicy;
        this.healthThresholds = healthThresholds;
        this.errorClassifier = errorClassifier;
        this.errorHistory = errorHistory;
        this.degradation = degradation;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public CircuitBreaker circuitBreaker(String name) {
        return circuitBreaker(name, defaultFailureThreshold, defaultRecoveryTimeout);
    }

    /**
     * Settings only apply when the breaker does not exist yet
     */
    public CircuitBreaker circuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        return circuitBreakers.computeIfAbsent(name, key -> new CircuitBreaker(
                circuitBreakerRegistry.circuitBreaker(key, CircuitBreaker.config(failureThreshold, recoveryTimeout)),
                recoveryTimeout,
                clock));
    }

    public RetryController retryController(String name) {
        return retryController(name, defaultRetryPolicy);
    }

    /**
     * The policy only applies when the controller does not exist yet
     */
    public RetryController retryController(String name, RetryPolicy policy) {
        return retryControllers.computeIfAbsent(name, key -> new RetryController(
                retryRegistry.retry(key, RetryController.config(policy, random)),
                policy,
                sleeper,
                random));
    }

    public GracefulDegradation degradation() {
        return degradation;
    }

    public ErrorClassifier errorClassifier() {
        return errorClassifier;
    }

    /**
     * Classify, log and remember an error raised by a service
     */
    public ErrorContext handleError(String serviceName, Throwable error, String context) {
        String message = ErrorClassifier.describe(error);
        ErrorContext errorContext = errorClassifier.classify(message);

        logger.error("Service {} error in {}: {} (Type: {}, Severity: {})",
                serviceName, context, message, errorContext.errorType().code(), errorContext.severity());

        errorHistory.append(new ErrorRecord(serviceName, message, context, errorContext, clock.instant()));
        return errorContext;
    }

    public SystemHealth getSystemHealth() {
        int recent = errorHistory.recent(healthThresholds.window()).size();
        double windowMinutes = healthThresholds.window().toSeconds() / 60.0;
        double errorRate = recent / windowMinutes;

        String overall;
        if (errorRate < healthThresholds.degradedRate()) {
            overall = SystemHealth.HEALTHY;
        } else if (errorRate < healthThresholds.criticalRate()) {
            overall = SystemHealth.DEGRADED;
        } else {
            overall = SystemHealth.CRITICAL;
        }

        return new SystemHealth(
                overall,
                errorRate,
                degradation.getServiceHealth(),
                circuitBreakerStatus(),
                recent,
                errorHistory.total()
        );
    }

    public Map<String, CircuitState> circuitBreakerStatus() {
        Map<String, CircuitState> status = new TreeMap<>();
        circuitBreakers.forEach((name, breaker) -> status.put(name, breaker.getState()));
        return status;
    }
}
