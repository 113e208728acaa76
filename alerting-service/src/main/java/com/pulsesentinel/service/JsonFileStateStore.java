package com.pulsesentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.pulsesentinel.core.config.JsonSupport;
import com.pulsesentinel.core.store.PersistenceException;
import com.pulsesentinel.core.store.StateStore;
import com.pulsesentinel.core.store.StoreKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link StateStore} writing one JSON array file per collection,
 * e.g. {@code <dir>/alerts.json}.
 *
 * <p>
 * Writes go to a temporary file that is then moved over the target, so a
 * crash mid-write leaves the previous version intact.
 * </p>
 */
public class JsonFileStateStore implements StateStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path directory;
    private final ObjectMapper mapper = JsonSupport.mapper();

    /**
     * @param directory created on first use if missing
     */
    public JsonFileStateStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public <T> Optional<List<T>> load(StoreKey<T> key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        CollectionType type = mapper.getTypeFactory().constructCollectionType(List.class, key.elementType());
        try {
            List<T> items = mapper.readValue(file.toFile(), type);
            LOG.debug("Loaded {} item(s) from {}", items.size(), file);
            return Optional.of(items);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file, e);
        }
    }

    @Override
    public synchronized <T> void save(StoreKey<T> key, List<T> items) {
        Path file = fileFor(key);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, key.name(), ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), items);
                try {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + file, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    Path fileFor(StoreKey<?> key) {
        return directory.resolve(key.name() + ".json");
    }
}
