package com.fever.resilience.infrastructure.cache.disk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;

/**
 * On-disk representation of one cache entry.
 * Times are stored as floating point seconds so the files stay readable by other tools.
 */
public record DiskRecord(
        @JsonProperty("value") JsonNode value,
        @JsonProperty("created_at") double createdAt,
        @JsonProperty("ttl") double ttl
) {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    public static DiskRecord of(JsonNode value, Instant createdAt, Duration ttl) {
        double created = createdAt.getEpochSecond() + createdAt.getNano() / NANOS_PER_SECOND;
        return new DiskRecord(value, created, ttl.toNanos() / NANOS_PER_SECOND);
    }

    public Instant createdAtInstant() {
        long seconds = (long) Math.floor(createdAt);
        long nanos = Math.round((createdAt - seconds) * NANOS_PER_SECOND);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    public Duration ttlDuration() {
        return Duration.ofNanos(Math.round(ttl * NANOS_PER_SECOND));
    }

    public Instant expiresAt() {
        return createdAtInstant().plus(ttlDuration());
    }

    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt());
    }
}
