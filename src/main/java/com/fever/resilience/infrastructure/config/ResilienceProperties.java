package com.fever.resilience.infrastructure.config;

import com.fever.resilience.infrastructure.resilience.HealthThresholds;
import com.fever.resilience.infrastructure.resilience.RetryPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for breakers, retries, the connection pool and health derivation
 */
@Component
@ConfigurationProperties(prefix = "resilience")
public class ResilienceProperties {

    private final Breaker breaker = new Breaker();
    private final Retry retry = new Retry();
    private final Pool pool = new Pool();
    private final Health health = new Health();

    public Breaker getBreaker() {
        return breaker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Pool getPool() {
        return pool;
    }

    public Health getHealth() {
        return health;
    }

    public static class Breaker {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double backoffFactor = 2.0;
        private boolean jitter = true;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoffFactor, jitter);
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class Pool {
        private int maxConnections = 5;
        private Duration timeout = Duration.ofSeconds(30);

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Health {
        private double degradedErrorRate = 1.0;
        private double criticalErrorRate = 5.0;
        private Duration window = Duration.ofHours(1);
        private int historySize = 100;

        public HealthThresholds toThresholds() {
            return new HealthThresholds(degradedErrorRate, criticalErrorRate, window);
        }

        public double getDegradedErrorRate() {
            return degradedErrorRate;
        }

        public void setDegradedErrorRate(double degradedErrorRate) {
            this.degradedErrorRate = degradedErrorRate;
        }

        public double getCriticalErrorRate() {
            return criticalErrorRate;
        }

        public void setCriticalErrorRate(double criticalErrorRate) {
            this.criticalErrorRate = criticalErrorRate;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getHistorySize() {
            return historySize;
        }

        public void setHistorySize(int historySize) {
            this.historySize = historySize;
        }
    }
}
