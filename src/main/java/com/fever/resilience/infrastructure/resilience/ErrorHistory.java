package com.fever.resilience.infrastructure.resilience;

import com.fever.resilience.domain.model.ErrorRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, append-only record of handled errors; the oldest record is dropped first
 */
public class ErrorHistory {

    private final int capacity;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<ErrorRecord> records = new ArrayDeque<>();

    public ErrorHistory(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public void append(ErrorRecord record) {
        lock.lock();
        try {
            records.addLast(record);
            while (records.size() > capacity) {
                records.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return records newer than {@code window}, oldest first
     */
    public List<ErrorRecord> recent(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        lock.lock();
        try {
            List<ErrorRecord> result = new ArrayList<>();
            for (ErrorRecord record : records) {
                if (record.timestamp().isAfter(cutoff)) {
                    result.add(record);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<ErrorRecord> all() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    public int total() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }
}
