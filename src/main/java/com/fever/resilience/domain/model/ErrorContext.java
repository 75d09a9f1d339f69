package com.fever.resilience.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Classification of a failed call, with the actions a human could take to recover
 */
public record ErrorContext(
        ErrorCategory errorType,
        ErrorSeverity severity,
        int retryCount,
        Instant lastErrorTime,
        List<String> recoverySuggestions
) {
    public ErrorContext {
        recoverySuggestions = List.copyOf(recoverySuggestions);
    }

    public static ErrorContext of(ErrorCategory category, Instant at) {
        return new ErrorContext(category, category.severity(), 0, at, category.suggestions());
    }

    public ErrorContext withRetryCount(int retries) {
        return new ErrorContext(errorType, severity, retries, lastErrorTime, recoverySuggestions);
    }
}
