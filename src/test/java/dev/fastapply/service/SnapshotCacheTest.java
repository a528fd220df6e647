package dev.fastapply.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.fastapply.model.JobSnapshot;
import dev.fastapply.store.InMemoryKeyValueStore;
import dev.fastapply.store.SessionStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotCacheTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private InMemoryKeyValueStore store;
    private SessionStorage storage;
    private SnapshotCache cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        storage = new SessionStorage(store, new ObjectMapper().registerModule(new JavaTimeModule()), "test");
        cache = newCache(3);
    }

    private SnapshotCache newCache(int capacity) {
        return new SnapshotCache(storage, capacity, Duration.ofDays(30), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JobSnapshot snapshot(String url, String title, Instant cachedAt) {
        return JobSnapshot.builder()
                .jobUrl(url)
                .title(title)
                .company("Acme")
                .cachedAt(cachedAt)
                .build();
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("Should survive a restart")
        void shouldSurviveRestart() {
            cache.cacheSwipedJob(snapshot("https://jobs.lever.co/acme/1", "Backend Engineer", NOW));

            SnapshotCache reloaded = newCache(3);

            assertThat(reloaded.getAllCachedJobs()).containsOnlyKeys("https://jobs.lever.co/acme/1");
            assertThat(reloaded.getCachedJob("https://jobs.lever.co/acme/1"))
                    .map(JobSnapshot::getTitle)
                    .contains("Backend Engineer");
        }

        @Test
        @DisplayName("Should evict the oldest entry above capacity")
        void shouldEvictOldestEntry() {
            cache.cacheSwipedJob(snapshot("u1", "One", NOW.minusSeconds(30)));
            cache.cacheSwipedJob(snapshot("u2", "Two", NOW.minusSeconds(20)));
            cache.cacheSwipedJob(snapshot("u3", "Three", NOW.minusSeconds(10)));
            cache.cacheSwipedJob(snapshot("u4", "Four", NOW));

            assertThat(cache.getAllCachedJobs()).containsOnlyKeys("u2", "u3", "u4");
        }

        @Test
        @DisplayName("Should move a re-cached job to the newest position")
        void shouldRefreshPositionOnRecache() {
            cache.cacheSwipedJob(snapshot("u1", "One", NOW.minusSeconds(30)));
            cache.cacheSwipedJob(snapshot("u2", "Two", NOW.minusSeconds(20)));
            cache.cacheSwipedJob(snapshot("u3", "Three", NOW.minusSeconds(10)));
            cache.cacheSwipedJob(snapshot("u1", "One again", NOW));
            cache.cacheSwipedJob(snapshot("u4", "Four", NOW));

            assertThat(cache.getAllCachedJobs()).containsOnlyKeys("u3", "u1", "u4");
        }

        @Test
        @DisplayName("Should remove entries older than the maximum age")
        void shouldCleanupOldEntries() {
            cache.cacheSwipedJob(snapshot("old", "Old", NOW.minus(Duration.ofDays(31))));
            cache.cacheSwipedJob(snapshot("fresh", "Fresh", NOW.minus(Duration.ofDays(1))));

            int removed = cache.cleanupOldEntries();

            assertThat(removed).isEqualTo(1);
            assertThat(cache.getAllCachedJobs()).containsOnlyKeys("fresh");
        }

        @Test
        @DisplayName("Should start empty when the stored cache is corrupt")
        void shouldStartEmptyOnCorruptStorage() {
            store.put("test:" + SnapshotCache.STORAGE_KEY, "[1,2");

            assertThat(newCache(3).size()).isZero();
        }
    }

    @Nested
    @DisplayName("Server data precedence")
    class ResolveTests {

        @Test
        @DisplayName("Should let server values override cached ones")
        void shouldPreferServerValues() {
            cache.cacheSwipedJob(snapshot("u1", "Cached title", NOW));

            JobSnapshot resolved = cache.resolve("u1", "Server title", null).orElseThrow();

            assertThat(resolved.getTitle()).isEqualTo("Server title");
            assertThat(resolved.getCompany()).isEqualTo("Acme");
            assertThat(cache.getCachedJob("u1")).map(JobSnapshot::getTitle).contains("Server title");
        }

        @Test
        @DisplayName("Should fall back to the cache when the server has nothing")
        void shouldFallBackToCache() {
            cache.cacheSwipedJob(snapshot("u1", "Cached title", NOW));

            assertThat(cache.resolve("u1", " ", null)).map(JobSnapshot::getTitle).contains("Cached title");
        }

        @Test
        @DisplayName("Should return empty when nobody knows the job")
        void shouldReturnEmptyForUnknownJob() {
            assertThat(cache.resolve("unknown", null, null)).isEmpty();
        }
    }
}
