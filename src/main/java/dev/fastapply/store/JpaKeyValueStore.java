package dev.fastapply.store;

import dev.fastapply.entity.KeyValueEntry;
import dev.fastapply.repository.KeyValueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Key-value store on the local SQLite database.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaKeyValueStore implements KeyValueStore {

    private final KeyValueRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        return repository.findById(key).map(KeyValueEntry::getPayload);
    }

    @Override
    @Transactional
    public void put(String key, String value) {
        KeyValueEntry entry = repository.findById(key)
                .orElseGet(() -> KeyValueEntry.builder().storageKey(key).build());
        entry.setPayload(value);
        entry.setUpdatedAt(LocalDateTime.now());
        repository.save(entry);
    }

    @Override
    @Transactional
    public void remove(String key) {
        repository.deleteById(key);
    }

    @Override
    @Transactional
    public void removeByPrefix(String prefix) {
        repository.deleteByStorageKeyStartingWith(prefix);
        log.debug("Removed stored entries under '{}'", prefix);
    }
}
