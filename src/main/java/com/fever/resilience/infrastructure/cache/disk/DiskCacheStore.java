package com.fever.resilience.infrastructure.cache.disk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fever.resilience.infrastructure.cache.CacheKeys;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-per-key store backing the persistent cache tier.
 * File names are the SHA-256 hex digest of the logical key plus {@value #SUFFIX}; the
 * directory is owned exclusively by this store. Every failure is logged and reported
 * as a miss or a no-op, never thrown.
 */
public class DiskCacheStore {

    private static final Logger logger = LoggerFactory.getLogger(DiskCacheStore.class);

    public static final String SUFFIX = ".cache";
    private static final String GLOB = "*" + SUFFIX;

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DiskCacheStore(Path directory, ObjectMapper objectMapper, Clock clock) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            logger.warn("Failed to create cache directory {}: {}", directory, e.getMessage());
        }
    }

    /**
     * Load a live record for the key. Expired records are deleted and reported as absent;
     * missing or unparseable files are misses.
     */
    public <V> Optional<StoredValue<V>> read(String key, Class<V> type) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            DiskRecord record = objectMapper.readValue(Files.readAllBytes(file), DiskRecord.class);
            if (record == null || record.value() == null || record.value().isNull()) {
                return Optional.empty();
            }
            if (!record.isLive(clock.instant())) {
                logger.debug("Disk entry expired, removing {}", file.getFileName());
                deleteQuietly(file);
                return Optional.empty();
            }
            V value = objectMapper.treeToValue(record.value(), type);
            return Optional.of(new StoredValue<>(value, record.createdAtInstant(), record.ttlDuration()));
        } catch (NoSuchFileException e) {
            // Removed between the existence check and the read
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to load from disk cache {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Synchronous best-effort write. The record is written to a temporary file and moved
     * into place so concurrent readers never observe a partial file.
     */
    public boolean write(String key, Object value, Instant createdAt, Duration ttl) {
        Path file = fileFor(key);
        Path tmp = null;
        try {
            JsonNode node = objectMapper.valueToTree(value);
            byte[] bytes = objectMapper.writeValueAsBytes(DiskRecord.of(node, createdAt, ttl));
            tmp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            Files.write(tmp, bytes);
            moveIntoPlace(tmp, file);
            return true;
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to save to disk cache {}: {}", file.getFileName(), e.getMessage());
            if (tmp != null) {
                deleteQuietly(tmp);
            }
            return false;
        }
    }

    public boolean delete(String key) {
        return deleteQuietly(fileFor(key));
    }

    /**
     * @return number of cache files removed
     */
    public int clear() {
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, GLOB)) {
            for (Path file : files) {
                if (deleteQuietly(file)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to clear disk cache files in {}: {}", directory, e.getMessage());
        }
        return removed;
    }

    /**
     * Delete cache files whose last modification is older than {@code maxAge}
     *
     * @return number of files removed
     */
    public int removeFilesOlderThan(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, GLOB)) {
            for (Path file : files) {
                try {
                    Instant modified = Files.getLastModifiedTime(file).toInstant();
                    if (modified.isBefore(cutoff) && deleteQuietly(file)) {
                        removed++;
                        logger.debug("Removed old cache file: {}", file.getFileName());
                    }
                } catch (IOException e) {
                    logger.warn("Failed to inspect cache file {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to clean up old cache files in {}: {}", directory, e.getMessage());
        }
        return removed;
    }

    public Path fileFor(String key) {
        return directory.resolve(CacheKeys.sha256Hex(key) + SUFFIX);
    }

    public Path directory() {
        return directory;
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete cache file {}: {}", file.getFileName(), e.getMessage());
            return false;
        }
    }

    /**
     * Value read back from disk together with its original lifetime
     */
    public record StoredValue<V>(V value, Instant createdAt, Duration ttl) {

        public Duration remaining(Instant now) {
            Duration left = Duration.between(now, createdAt.plus(ttl));
            return left.isNegative() ? Duration.ZERO : left;
        }
    }
}
