package com.fever.resilience.infrastructure.resilience;

/**
 * Raised instead of invoking the protected call while a breaker is open
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName) {
        super("Circuit breaker is OPEN - service '" + breakerName + "' temporarily unavailable");
        this.breakerName = breakerName;
    }

    public CircuitBreakerOpenException(String breakerName, Throwable cause) {
        this(breakerName);
        initCause(cause);
    }

    public String getBreakerName() {
        return breakerName;
    }
}
