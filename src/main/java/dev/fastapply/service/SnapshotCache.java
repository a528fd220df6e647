package dev.fastapply.service;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.fastapply.model.JobSnapshot;
import dev.fastapply.store.SessionStorage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Local cache of swiped job metadata, keyed by job URL.
 * <p>
 * The cache is advisory: it fills the gaps while the worker has not returned
 * (or not yet denormalized) a job's title and company, and anything the worker
 * does return overrides what is cached here. Entries are kept in cachedAt
 * order so the oldest one is evicted first once {@code capacity} is exceeded.
 */
@Slf4j
public class SnapshotCache {

    static final String STORAGE_KEY = "swiped_jobs_cache";
    private static final TypeReference<Map<String, JobSnapshot>> CACHE_TYPE = new TypeReference<>() {
    };

    private final SessionStorage storage;
    private final int capacity;
    private final Duration maxAge;
    private final Clock clock;

    private final LinkedHashMap<String, JobSnapshot> entries = new LinkedHashMap<>();
    private boolean loaded;

    public SnapshotCache(SessionStorage storage, int capacity, Duration maxAge, Clock clock) {
        this.storage = storage;
        this.capacity = capacity;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    /**
     * Load the cache from storage. Reads the disk once per session.
     */
    public synchronized void ensureCacheLoaded() {
        if (loaded) {
            return;
        }

        storage.read(STORAGE_KEY, CACHE_TYPE).ifPresent(stored -> stored.values().stream()
                .filter(snapshot -> snapshot.getJobUrl() != null)
                .sorted(Comparator.comparing(JobSnapshot::getCachedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .forEach(snapshot -> entries.put(snapshot.getJobUrl(), snapshot)));
        loaded = true;
        log.debug("Loaded {} cached job snapshots", entries.size());
    }

    /**
     * Snapshot of every cached job, keyed by URL, oldest first.
     */
    public synchronized Map<String, JobSnapshot> getAllCachedJobs() {
        ensureCacheLoaded();
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public synchronized Optional<JobSnapshot> getCachedJob(String url) {
        ensureCacheLoaded();
        return Optional.ofNullable(entries.get(url));
    }

    public synchronized int size() {
        ensureCacheLoaded();
        return entries.size();
    }

    /**
     * Add or refresh the snapshot of a swiped job.
     */
    public synchronized void cacheSwipedJob(JobSnapshot snapshot) {
        ensureCacheLoaded();
        entries.remove(snapshot.getJobUrl());
        entries.put(snapshot.getJobUrl(), snapshot);
        evictOverflow();
        save();
    }

    /**
     * Merge worker data with the cached snapshot of a URL.
     * Non-blank worker values win and refresh the cache entry.
     *
     * @return the merged view, empty when neither side knows the job
     */
    public synchronized Optional<JobSnapshot> resolve(String url, String serverTitle, String serverCompany) {
        ensureCacheLoaded();
        JobSnapshot cached = entries.get(url);
        boolean hasTitle = serverTitle != null && !serverTitle.isBlank();
        boolean hasCompany = serverCompany != null && !serverCompany.isBlank();

        if (cached == null) {
            if (!hasTitle && !hasCompany) {
                return Optional.empty();
            }
            return Optional.of(JobSnapshot.builder()
                    .jobUrl(url)
                    .title(serverTitle)
                    .company(serverCompany)
                    .build());
        }

        if (!hasTitle && !hasCompany) {
            return Optional.of(cached);
        }

        JobSnapshot merged = cached.toBuilder()
                .title(hasTitle ? serverTitle : cached.getTitle())
                .company(hasCompany ? serverCompany : cached.getCompany())
                .build();
        if (!merged.equals(cached)) {
            entries.put(url, merged);
            save();
        }
        return Optional.of(merged);
    }

    /**
     * Drop entries older than the configured maximum age.
     *
     * @return number of removed entries
     */
    public synchronized int cleanupOldEntries() {
        ensureCacheLoaded();
        Instant cutoff = clock.instant().minus(maxAge);
        int before = entries.size();
        entries.values().removeIf(snapshot -> snapshot.getCachedAt() != null
                && snapshot.getCachedAt().isBefore(cutoff));

        int removed = before - entries.size();
        if (removed > 0) {
            save();
            log.info("Removed {} job snapshots older than {} days", removed, maxAge.toDays());
        }
        return removed;
    }

    public synchronized void clear() {
        entries.clear();
        loaded = true;
        storage.remove(STORAGE_KEY);
    }

    private void evictOverflow() {
        Iterator<String> oldestFirst = entries.keySet().iterator();
        while (entries.size() > capacity && oldestFirst.hasNext()) {
            String evicted = oldestFirst.next();
            oldestFirst.remove();
            log.debug("Evicted job snapshot {}", evicted);
        }
    }

    private void save() {
        try {
            storage.write(STORAGE_KEY, entries);
        } catch (RuntimeException e) {
            // The in-memory copy stays authoritative for this session
            log.error("Failed to save job snapshot cache: {}", e.getMessage());
        }
    }
}
