package dev.fastapply.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Key-value store kept in memory, for tests that do not need the database.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> values = new ConcurrentSkipListMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(String key, String value) {
        values.put(key, value);
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }

    @Override
    public void removeByPrefix(String prefix) {
        values.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(values);
    }
}
