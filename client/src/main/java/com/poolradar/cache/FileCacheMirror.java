package com.poolradar.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Mirrors cache entries as one JSON file per fingerprint: {@code {"key", "captured_at", "payload"}}.
 * Files older than the TTL, or that fail to parse, are deleted on read.
 */
@Slf4j
public class FileCacheMirror implements CacheMirror {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public FileCacheMirror(Path directory, ObjectMapper objectMapper, Duration ttl, Clock clock) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create cache directory " + directory, e);
        }
    }

    @Override
    public <T> Optional<MirroredValue<T>> load(String fingerprint, JavaType type) {
        Path file = fileFor(fingerprint);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            JsonNode capturedNode = root.path("captured_at");
            if (!capturedNode.canConvertToLong() || !root.has("payload")) {
                log.warn("Malformed cache mirror file {}, deleting", file);
                delete(file);
                return Optional.empty();
            }
            Instant capturedAt = Instant.ofEpochMilli(capturedNode.asLong());
            if (Duration.between(capturedAt, clock.instant()).compareTo(ttl) >= 0) {
                log.debug("Cache mirror file {} expired (captured {})", file, capturedAt);
                delete(file);
                return Optional.empty();
            }
            T value = objectMapper.readerFor(type).readValue(root.get("payload"));
            if (value == null) {
                delete(file);
                return Optional.empty();
            }
            return Optional.of(new MirroredValue<>(value, capturedAt));
        } catch (IOException e) {
            log.warn("Unreadable cache mirror file {}: {}", file, e.getMessage());
            delete(file);
            return Optional.empty();
        }
    }

    @Override
    public void store(String fingerprint, Object value) {
        Path file = fileFor(fingerprint);
        Path tmp = directory.resolve(fingerprint + ".tmp");
        ObjectNode root = objectMapper.createObjectNode();
        root.put("key", fingerprint);
        root.put("captured_at", clock.millis());
        root.set("payload", objectMapper.valueToTree(value));
        try {
            objectMapper.writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to mirror cache entry {} to {}: {}", fingerprint, file, e.getMessage());
            delete(tmp);
        }
    }

    private Path fileFor(String fingerprint) {
        return directory.resolve(fingerprint + SUFFIX);
    }

    private void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache mirror file {}: {}", file, e.getMessage());
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
