package com.fever.resilience.domain.model;

import java.time.Duration;

/**
 * Accumulated timing and outcome of one named operation since process start
 */
public record OperationMetrics(
        Duration totalTime,
        long callCount,
        long successCount,
        long errorCount,
        Duration minTime,
        Duration maxTime,
        Duration avgTime
) {
    public double errorRatio() {
        return callCount > 0 ? (double) errorCount / callCount : 0.0;
    }
}
