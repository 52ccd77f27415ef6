/* (C)2026 */
package com.ammann.updatetracker.cache;

import com.ammann.updatetracker.model.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Cache repository storing one JSON document per key in a directory, so that cached results
 * survive restarts.
 *
 * <p>Writes go to a temporary file that is then moved over the target. An unreadable file is
 * logged and treated as absent, which makes the next read rebuild it from the container hosts.
 */
public class FileCacheRepository implements CacheRepository {

    private static final Logger LOG = Logger.getLogger(FileCacheRepository.class);

    private static final Pattern SAFE_KEY = Pattern.compile("^[A-Za-z0-9._-]+$");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCacheRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CacheEntry.class));
        } catch (IOException e) {
            LOG.warnf(e, "Ignoring unreadable cache file %s", file);
            return Optional.empty();
        }
    }

    @Override
    public void write(CacheEntry entry) {
        Path file = fileFor(entry.key());
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, entry.key(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), entry);
            try {
                Files.move(
                        tmp,
                        file,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            discard(tmp);
            if (e instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new UncheckedIOException(
                    "Failed to write cache entry " + entry.key(), (IOException) e);
        }
    }

    private void discard(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warnf(e, "Could not remove temporary cache file %s", tmp);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete cache entry " + key, e);
        }
    }

    private Path fileFor(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid cache key: " + key);
        }
        return directory.resolve(key + ".json");
    }
}
