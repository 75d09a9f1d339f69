package com.fever.resilience.infrastructure.pool;

import java.time.Duration;

/**
 * A pooled call did not complete within the pool timeout
 */
public class ConnectionPoolTimeoutException extends RuntimeException {

    public ConnectionPoolTimeoutException(Duration timeout, Throwable cause) {
        super("Pooled call timed out after " + timeout.toMillis() + " ms", cause);
    }
}
