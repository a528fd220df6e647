package dev.fastapply.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One value of the local key-value store (automation map, pending URLs, snapshot cache, ...).
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "local_kv", indexes = {
        @Index(name = "idx_updated_at", columnList = "updatedAt")
})
public class KeyValueEntry {

    @Id
    @Column(name = "storage_key", length = 512)
    private String storageKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
