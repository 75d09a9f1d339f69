package com.fever.resilience.domain.model;

import java.time.Instant;

/**
 * One handled failure, as kept in the bounded error history
 */
public record ErrorRecord(
        String service,
        String error,
        String context,
        ErrorContext errorContext,
        Instant timestamp
) {}
