package com.fever.resilience.infrastructure.resilience;

import com.fever.resilience.domain.model.CircuitState;
import com.fever.resilience.domain.port.out.RemoteCall;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Three-state circuit breaker around an unreliable call, backed by a resilience4j breaker.
 *
 * <ul>
 *   <li>CLOSED: calls pass; consecutive failures are counted and reaching the threshold opens the breaker</li>
 *   <li>OPEN: calls are rejected with {@link CircuitBreakerOpenException} until the recovery timeout
 *       has passed since the last failure, then the breaker moves to HALF_OPEN</li>
 *   <li>HALF_OPEN: a single trial call passes; success closes the breaker, failure re-opens it</li>
 * </ul>
 *
 * The delegate uses a count-based window as large as the threshold with a 100% failure rate,
 * so it opens exactly on N consecutive failures. The recovery timeout is measured on the injected
 * clock and the OPEN to HALF_OPEN move is made explicitly.
 *
 * <p>Every admitted call is stamped with the generation current at admission. Each state transition
 * starts a new generation and outcomes from an older one are dropped, so a slow call admitted while
 * CLOSED cannot decide a later trial.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private static final Duration MIN_WAIT_IN_OPEN_STATE = Duration.ofMillis(1);

    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong generation = new AtomicLong();
    private int failureCount;
    private Instant lastFailureTime = Instant.EPOCH;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this(io.github.resilience4j.circuitbreaker.CircuitBreaker.of(name, config(failureThreshold, recoveryTimeout)),
                recoveryTimeout, clock);
    }

    public CircuitBreaker(io.github.resilience4j.circuitbreaker.CircuitBreaker delegate,
                          Duration recoveryTimeout,
                          Clock clock) {
        this.delegate = delegate;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
        delegate.getEventPublisher().onStateTransition(this::onStateTransition);
    }

    /**
     * Delegate settings for a breaker that opens after the given number of consecutive failures
     */
    public static CircuitBreakerConfig config(int failureThreshold, Duration recoveryTimeout) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        Duration waitInOpenState = recoveryTimeout.compareTo(MIN_WAIT_IN_OPEN_STATE) < 0
                ? MIN_WAIT_IN_OPEN_STATE
                : recoveryTimeout;
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(waitInOpenState)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .slowCallDurationThreshold(Duration.ofDays(1))
                .build();
    }

    public <T> T execute(Callable<T> call) throws Exception {
        long admittedIn = acquirePermission();
        long start = System.nanoTime();
        try {
            T result = call.call();
            onSuccess(admittedIn, System.nanoTime() - start);
            return result;
        } catch (Exception | Error e) {
            onFailure(admittedIn, System.nanoTime() - start, e);
            throw e;
        }
    }

    public <I, O> RemoteCall<I, O> decorate(RemoteCall<I, O> call) {
        return input -> execute(() -> call.call(input));
    }

    private long acquirePermission() {
        lock.lock();
        try {
            if (delegate.getState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.OPEN) {
                Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
                if (sinceFailure.compareTo(recoveryTimeout) <= 0) {
                    throw new CircuitBreakerOpenException(getName());
                }
                delegate.transitionToHalfOpenState();
            }
            delegate.acquirePermission();
            return generation.get();
        } catch (CallNotPermittedException e) {
            throw new CircuitBreakerOpenException(getName(), e);
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(long admittedIn, long durationNanos) {
        lock.lock();
        try {
            if (admittedIn != generation.get()) {
                logger.debug("Circuit breaker '{}' ignoring success of a call admitted before the last transition",
                        getName());
                return;
            }
            failureCount = 0;
            delegate.onSuccess(durationNanos, TimeUnit.NANOSECONDS);
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(long admittedIn, long durationNanos, Throwable error) {
        lock.lock();
        try {
            if (admittedIn != generation.get()) {
                logger.debug("Circuit breaker '{}' ignoring failure of a call admitted before the last transition: {}",
                        getName(), error.getMessage());
                return;
            }
            failureCount++;
            lastFailureTime = clock.instant();
            delegate.onError(durationNanos, TimeUnit.NANOSECONDS, error);
        } finally {
            lock.unlock();
        }
    }

    private void onStateTransition(CircuitBreakerOnStateTransitionEvent event) {
        generation.incrementAndGet();
        CircuitState from = toCircuitState(event.getStateTransition().getFromState());
        switch (toCircuitState(event.getStateTransition().getToState())) {
            case OPEN -> {
                if (from == CircuitState.HALF_OPEN) {
                    logger.warn("Circuit breaker '{}' trial call failed, re-opening", getName());
                } else {
                    logger.error("Circuit breaker '{}' OPENED after {} failures", getName(), failureCount);
                }
            }
            case HALF_OPEN -> logger.info("Circuit breaker '{}' entering HALF_OPEN state", getName());
            case CLOSED -> logger.info("Circuit breaker '{}' returning to CLOSED state", getName());
        }
    }

    /**
     * Force the breaker back to CLOSED, for manual recovery
     */
    public void reset() {
        lock.lock();
        try {
            delegate.reset();
            generation.incrementAndGet();
            failureCount = 0;
            logger.info("Circuit breaker '{}' reset", getName());
        } finally {
            lock.unlock();
        }
    }

    private static CircuitState toCircuitState(io.github.resilience4j.circuitbreaker.CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    public CircuitState getState() {
        return toCircuitState(delegate.getState());
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return delegate.getName();
    }

    public int getFailureThreshold() {
        return delegate.getCircuitBreakerConfig().getSlidingWindowSize();
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }
}
