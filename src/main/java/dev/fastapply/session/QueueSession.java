package dev.fastapply.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.fastapply.batch.BatchAccumulator;
import dev.fastapply.batch.BatchListener;
import dev.fastapply.client.AutomationWorkerClient;
import dev.fastapply.config.SwipeQueueProperties;
import dev.fastapply.metrics.QueueMetrics;
import dev.fastapply.service.QueueManager;
import dev.fastapply.service.SnapshotCache;
import dev.fastapply.store.KeyValueStore;
import dev.fastapply.store.SessionStorage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;

/**
 * All swipe queue state of one signed-in user.
 * <p>
 * Owns the snapshot cache, the queue manager and the profile guard, all persisting
 * under the session's storage namespace. Sessions with different namespaces share
 * nothing, so several can live in one process.
 */
@Slf4j
@Getter
public class QueueSession {

    private final SessionStorage storage;
    private final SnapshotCache snapshotCache;
    private final QueueManager queueManager;
    private final ProfileScopeGuard guard;

    public QueueSession(String namespace, KeyValueStore store, ObjectMapper objectMapper,
            AutomationWorkerClient client, SwipeQueueProperties properties, QueueMetrics metrics,
            BatchListener listener, Scheduler scheduler, Clock clock) {
        this.storage = new SessionStorage(store, objectMapper, namespace);
        this.snapshotCache = new SnapshotCache(storage, properties.getSnapshot().getCapacity(),
                properties.getSnapshot().getMaxAge(), clock);
        this.queueManager = new QueueManager(client, storage, properties, metrics, clock);
        this.guard = new ProfileScopeGuard((profile, resumeSettings) -> BatchAccumulator.builder()
                .profileId(profile.profileId())
                .profileName(profile.profileName())
                .queueManager(queueManager)
                .snapshotCache(snapshotCache)
                .storage(storage)
                .properties(properties)
                .resumeSettings(resumeSettings)
                .listener(listener)
                .metrics(metrics)
                .scheduler(scheduler)
                .build(), listener, clock);
    }

    public void init() {
        snapshotCache.ensureCacheLoaded();
        snapshotCache.cleanupOldEntries();
        queueManager.initialize();
        log.info("Queue session '{}' ready: {} cached jobs, {} pending URLs",
                storage.getNamespace(), snapshotCache.size(), queueManager.getPendingUrlsCount());
    }

    /**
     * Stop all debounce timers. Pending batches stay persisted and are restored next time.
     */
    public void close() {
        guard.close();
        log.info("Queue session '{}' closed", storage.getNamespace());
    }

    /**
     * Close the session and wipe everything it stored.
     */
    public void signOut() {
        guard.close();
        queueManager.clearCache();
        snapshotCache.clear();
        storage.removeAll();
        log.info("Queue session '{}' signed out, local state cleared", storage.getNamespace());
    }
}
