package dev.fastapply.store;

import java.util.Optional;

/**
 * Durable string key-value persistence backing the session state.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);

    /**
     * Remove every key starting with the given prefix.
     */
    void removeByPrefix(String prefix);
}
