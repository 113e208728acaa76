package com.pulsesentinel.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.pulsesentinel.core.config.JsonSupport;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StateStore} keeping each collection as a JSON string in memory.
 *
 * <p>
 * Going through JSON gives callers the same copy semantics and the same
 * serialisation failures as a durable store, without touching the disk.
 * </p>
 */
public class InMemoryStateStore implements StateStore {

    private final ObjectMapper mapper = JsonSupport.mapper();
    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<List<T>> load(StoreKey<T> key) {
        String json = documents.get(key.name());
        if (json == null) {
            return Optional.empty();
        }
        CollectionType type = mapper.getTypeFactory().constructCollectionType(List.class, key.elementType());
        try {
            return Optional.of(mapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to read collection '" + key + "'", e);
        }
    }

    @Override
    public <T> void save(StoreKey<T> key, List<T> items) {
        try {
            documents.put(key.name(), mapper.writeValueAsString(items));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to write collection '" + key + "'", e);
        }
    }

    /**
     * @return raw JSON of a collection, for inspection
     */
    public Optional<String> rawDocument(StoreKey<?> key) {
        return Optional.ofNullable(documents.get(key.name()));
    }
}
