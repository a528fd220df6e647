package dev.fastapply.repository;

import dev.fastapply.entity.KeyValueEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for local key-value entries.
 */
@Repository
public interface KeyValueRepository extends JpaRepository<KeyValueEntry, String> {

    /**
     * Find every entry of a namespace.
     */
    List<KeyValueEntry> findByStorageKeyStartingWith(String prefix);

    /**
     * Delete every entry of a namespace.
     */
    void deleteByStorageKeyStartingWith(String prefix);
}
