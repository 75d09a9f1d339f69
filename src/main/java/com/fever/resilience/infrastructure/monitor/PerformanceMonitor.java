package com.fever.resilience.infrastructure.monitor;

import com.fever.resilience.domain.model.OperationMetrics;
import com.fever.resilience.domain.port.out.RemoteCall;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-operation timing and outcome counters, accumulated for the lifetime of the process.
 * Readers only ever get immutable snapshots.
 */
public class PerformanceMonitor {

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Accumulator> metrics = new HashMap<>();

    public PerformanceMonitor(Clock clock) {
        this.clock = clock;
    }

    public void record(String operation, Duration duration, boolean success) {
        lock.lock();
        try {
            metrics.computeIfAbsent(operation, key -> new Accumulator()).add(duration, success);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run the call and record its duration and outcome under {@code operation}
     */
    public <I, O> RemoteCall<I, O> timed(String operation, RemoteCall<I, O> call) {
        return input -> {
            Instant start = clock.instant();
            boolean success = false;
            try {
                O result = call.call(input);
                success = true;
                return result;
            } finally {
                record(operation, Duration.between(start, clock.instant()), success);
            }
        };
    }

    public Map<String, OperationMetrics> getMetrics() {
        lock.lock();
        try {
            Map<String, OperationMetrics> snapshot = new TreeMap<>();
            metrics.forEach((name, accumulator) -> snapshot.put(name, accumulator.snapshot()));
            return Collections.unmodifiableMap(snapshot);
        } finally {
            lock.unlock();
        }
    }

    public Optional<OperationMetrics> getOperationStats(String operation) {
        lock.lock();
        try {
            return Optional.ofNullable(metrics.get(operation)).map(Accumulator::snapshot);
        } finally {
            lock.unlock();
        }
    }

    private static final class Accumulator {
        private Duration totalTime = Duration.ZERO;
        private long callCount;
        private long successCount;
        private long errorCount;
        private Duration minTime;
        private Duration maxTime = Duration.ZERO;

        void add(Duration duration, boolean success) {
            totalTime = totalTime.plus(duration);
            callCount++;
            if (success) {
                successCount++;
            } else {
                errorCount++;
            }
            if (minTime == null || duration.compareTo(minTime) < 0) {
                minTime = duration;
            }
            if (duration.compareTo(maxTime) > 0) {
                maxTime = duration;
            }
        }

        OperationMetrics snapshot() {
            Duration avg = totalTime.dividedBy(callCount);
            return new OperationMetrics(totalTime, callCount, successCount, errorCount, minTime, maxTime, avg);
        }
    }
}
