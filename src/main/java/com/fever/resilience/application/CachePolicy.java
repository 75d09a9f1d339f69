package com.fever.resilience.application;

import java.time.Duration;

/**
 * How a call result is cached: lifetime (null means the tier default) and which cache holds it
 */
public record CachePolicy(Duration ttl, CacheLevel level) {

    public static CachePolicy memory(Duration ttl) {
        return new CachePolicy(ttl, CacheLevel.MEMORY);
    }

    public static CachePolicy disk(Duration ttl) {
        return new CachePolicy(ttl, CacheLevel.DISK);
    }
}
