package com.fever.resilience.domain.port.out;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache tier abstraction
 * Absence is a value: implementations never throw for misses or expiry
 */
public interface ResponseCache<V> {

    /**
     * @return Optional.empty() on miss or expiry, otherwise the cached value
     */
    Optional<V> get(String key);

    /**
     * Store a value using the tier's default time-to-live
     */
    void set(String key, V value);

    /**
     * Store a value with an explicit time-to-live; a null ttl means the tier default
     */
    void set(String key, V value, Duration ttl);

    /**
     * Drop every entry and reset counters
     */
    void clear();
}
