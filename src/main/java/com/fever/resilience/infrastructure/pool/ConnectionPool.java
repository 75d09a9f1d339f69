package com.fever.resilience.infrastructure.pool;

import com.fever.resilience.domain.port.out.RemoteCall;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed budget of worker threads for blocking remote calls.
 * At most {@code maxConnections} calls run at once; further submissions queue. The caller
 * blocks until its call finishes or the timeout elapses, measured from submission.
 * Errors of the call are rethrown unchanged.
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final int maxConnections;
    private final Duration timeout;
    private final ExecutorService executor;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public ConnectionPool(int maxConnections) {
        this(maxConnections, DEFAULT_TIMEOUT);
    }

    public ConnectionPool(int maxConnections, Duration timeout) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        }
        this.maxConnections = maxConnections;
        this.timeout = timeout;
        this.executor = Executors.newFixedThreadPool(maxConnections, new PoolThreadFactory());
    }

    public <T> T execute(Callable<T> call) throws Exception {
        if (activeConnections.get() >= maxConnections) {
            logger.warn("Connection pool exhausted ({} active), call will queue", maxConnections);
        }

        Future<T> future = executor.submit(() -> {
            activeConnections.incrementAndGet();
            try {
                return call.call();
            } finally {
                activeConnections.decrementAndGet();
            }
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Pooled call exceeded {} ms, cancelled", timeout.toMillis());
            throw new ConnectionPoolTimeoutException(timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    public <I, O> RemoteCall<I, O> decorate(RemoteCall<I, O> call) {
        return input -> execute(() -> call.call(input));
    }

    public PoolStats getStats() {
        return new PoolStats(activeConnections.get(), maxConnections);
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class PoolThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "remote-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
