package com.fever.resilience.infrastructure.resilience;

import com.fever.resilience.domain.port.out.RemoteCall;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous retry with exponential backoff and optional jitter, backed by a resilience4j retry.
 * The delegate decides whether another attempt is allowed and how long to wait; the wait itself
 * goes through the {@link Sleeper} and blocks the calling thread. On exhaustion the last error is
 * rethrown as-is. Callers needing a deadline compose this with one, e.g. through the connection pool.
 */
public class RetryController {

    private static final Logger logger = LoggerFactory.getLogger(RetryController.class);

    private final Retry delegate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryController(String name, RetryPolicy policy) {
        this(name, policy, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryController(String name, RetryPolicy policy, Sleeper sleeper, DoubleSupplier random) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.random = random;
        this.delegate = Retry.of(name, config(policy, random));
    }

    /**
     * Wraps an existing delegate, e.g. one handed out by a {@code RetryRegistry}
     */
    public RetryController(Retry delegate, RetryPolicy policy, Sleeper sleeper, DoubleSupplier random) {
        this.delegate = delegate;
        this.policy = policy;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Delegate settings allowing {@code maxRetries + 1} attempts, waiting the jittered backoff between them
     */
    public static RetryConfig config(RetryPolicy policy, DoubleSupplier random) {
        IntervalFunction interval = failureNumber -> delayAfterFailure(policy, random, failureNumber).toMillis();
        return RetryConfig.custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(interval)
                .build();
    }

    public <T> T execute(Callable<T> call) throws Exception {
        Retry.AsyncContext<T> context = delegate.asyncContext();
        int attempt = 0;
        while (true) {
            attempt++;
            T result;
            try {
                result = call.call();
            } catch (Exception e) {
                long waitMillis = context.onError(e);
                if (waitMillis < 0) {
                    logger.error("All {} retries failed for {}: {}", policy.maxRetries(), getName(), e.getMessage());
                    throw e;
                }

                logger.warn("Attempt {} failed for {}, retrying in {} ms: {}",
                        attempt, getName(), waitMillis, e.getMessage());
                try {
                    sleeper.sleep(Duration.ofMillis(waitMillis));
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    logger.warn("Retry of {} interrupted after attempt {}", getName(), attempt);
                    throw e;
                }
                continue;
            }
            context.onComplete();
            return result;
        }
    }

    public <I, O> RemoteCall<I, O> decorate(RemoteCall<I, O> call) {
        return input -> execute(() -> call.call(input));
    }

    /**
     * Delay to wait after the given failure, including jitter when enabled
     */
    public Duration delayAfterFailure(int failureNumber) {
        return delayAfterFailure(policy, random, failureNumber);
    }

    private static Duration delayAfterFailure(RetryPolicy policy, DoubleSupplier random, int failureNumber) {
        Duration delay = policy.backoffAfterFailure(failureNumber);
        if (!policy.jitter()) {
            return delay;
        }
        double factor = 0.5 + random.getAsDouble() * 0.5;
        return Duration.ofNanos((long) (delay.toNanos() * factor));
    }

    public String getName() {
        return delegate.getName();
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
