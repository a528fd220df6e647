package dev.fastapply.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * JSON view of a {@link KeyValueStore}, scoped to one session namespace.
 */
@Slf4j
public class SessionStorage {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    @Getter
    private final String namespace;

    public SessionStorage(KeyValueStore store, ObjectMapper objectMapper, String namespace) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
    }

    /**
     * Read and decode a stored value.
     * An unreadable value is discarded so a corrupt entry cannot block a warm start.
     */
    public <T> Optional<T> read(String key, TypeReference<T> type) {
        String qualified = qualify(key);
        Optional<String> raw = store.get(qualified);
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable value stored under '{}': {}", qualified, e.getOriginalMessage());
            store.remove(qualified);
            return Optional.empty();
        }
    }

    public void write(String key, Object value) {
        String qualified = qualify(key);
        try {
            store.put(qualified, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode value for " + qualified, e);
        }
    }

    public void remove(String key) {
        store.remove(qualify(key));
    }

    /**
     * Remove everything this session ever stored.
     */
    public void removeAll() {
        store.removeByPrefix(namespace + ":");
    }

    private String qualify(String key) {
        return namespace + ":" + key;
    }
}
