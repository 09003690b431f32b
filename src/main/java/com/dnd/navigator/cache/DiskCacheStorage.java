package com.dnd.navigator.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Durable tier of the cache: one JSON file per key, grouped in one directory per
 * {@link CacheKey#group()}.
 *
 * <p>Each file holds the key, the value, the creation timestamp and the TTL so expiry can be
 * reconstructed after a restart. Writes go to a temporary file in the target directory that is
 * then renamed over the destination, so a reader sees either the previous file or the new one,
 * never a partial write.</p>
 */
public class DiskCacheStorage {
    private static final Logger log = LoggerFactory.getLogger(DiskCacheStorage.class);

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final String SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper objectMapper;

    public DiskCacheStorage(Path root) {
        this(root, new ObjectMapper());
    }

    public DiskCacheStorage(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Reads the stored entry for a key.
     *
     * @return the entry, or empty if no file exists
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public Optional<CacheEntry> read(CacheKey key) throws IOException {
        Path file = pathFor(key);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        StoredEntry stored = objectMapper.readValue(bytes, StoredEntry.class);
        if (stored.value() == null || stored.key() == null || !stored.key().equals(key.value())) {
            throw new IOException("Cache file " + file + " does not hold an entry for " + key.value());
        }
        return Optional.of(new CacheEntry(
                stored.key(),
                stored.value(),
                Instant.ofEpochMilli(stored.createdAtMillis()),
                Duration.ofMillis(stored.ttlMillis())));
    }

    /**
     * Writes an entry, replacing any previous file for the same key.
     *
     * @throws IOException if the entry could not be committed
     */
    public void write(CacheKey key, CacheEntry entry) throws IOException {
        Path target = pathFor(key);
        Path dir = target.getParent();
        Files.createDirectories(dir);

        StoredEntry stored = new StoredEntry(entry.key(), entry.createdAt().toEpochMilli(),
                entry.ttl().toMillis(), entry.value());
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, objectMapper.writeValueAsBytes(stored));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to replace", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Checks that the root directory exists (creating it if needed) and is writable.
     */
    public boolean isWritable() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (IOException e) {
            log.warn("Cache directory {} is not usable: {}", root, e.getMessage());
            return false;
        }
    }

    Path pathFor(CacheKey key) {
        return root.resolve(safeName(key.group())).resolve(safeName(key.value()) + SUFFIX);
    }

    static String safeName(String raw) {
        String safe = UNSAFE_CHARS.matcher(raw).replaceAll("_");
        if (safe.equals(raw) && !safe.startsWith(".")) {
            return safe;
        }
        // sanitising may map distinct keys to one name
        return safe + "-" + Integer.toHexString(raw.hashCode());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredEntry(String key, long createdAtMillis, long ttlMillis, JsonNode value) {}
}
