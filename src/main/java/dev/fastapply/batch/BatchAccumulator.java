package dev.fastapply.batch;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.fastapply.config.SwipeQueueProperties;
import dev.fastapply.error.BatchError;
import dev.fastapply.error.ErrorKind;
import dev.fastapply.metrics.QueueMetrics;
import dev.fastapply.model.Automation;
import dev.fastapply.model.JobSnapshot;
import dev.fastapply.model.PendingBatch;
import dev.fastapply.model.PendingJob;
import dev.fastapply.model.ResumeSettings;
import dev.fastapply.model.SwipedJob;
import dev.fastapply.service.QueueManager;
import dev.fastapply.service.QueueManager.QueueResult;
import dev.fastapply.service.SnapshotCache;
import dev.fastapply.store.SessionStorage;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Debounces the right-swipes of one profile into batched submissions.
 * <p>
 * Swipes only touch local state: the job snapshot is cached, the job joins the
 * pending batch and the debounce timer is re-armed. The batch is submitted when
 * the timer expires, on an explicit {@link #flushAndReset()}, or as soon as it
 * hits the size or age ceiling. Timer and manual flushes share one single-flight
 * path, and a flush only ever submits the jobs pending when it started.
 * <p>
 * Jobs that failed transiently stay in the batch, ahead of newer swipes, until
 * they exhaust their attempts.
 */
@Slf4j
public class BatchAccumulator {

    static final String STORAGE_KEY_PREFIX = "swipe_batch_pending_jobs:";
    private static final TypeReference<List<PendingJob>> PENDING_JOBS_TYPE = new TypeReference<>() {
    };

    /**
     * Outcome of one flush.
     *
     * @param automation automation the jobs went to, null when nothing was sent
     * @param retained   jobs kept for the next flush after a transient failure
     */
    public record BatchResult(String profileId, Automation automation, int sent, int retained,
            List<BatchError> errors) {

        public static BatchResult empty(String profileId) {
            return new BatchResult(profileId, null, 0, 0, List.of());
        }

        public boolean isEmpty() {
            return sent == 0 && retained == 0 && errors.isEmpty();
        }
    }

    private record Submission(PendingJob job, QueueResult result) {
    }

    @Getter
    private final String profileId;
    private final String profileName;
    private final QueueManager queueManager;
    private final SnapshotCache snapshotCache;
    private final SessionStorage storage;
    private final SwipeQueueProperties properties;
    private final Supplier<ResumeSettings> resumeSettings;
    private final BatchListener listener;
    private final QueueMetrics metrics;
    private final Scheduler scheduler;

    private final PendingBatch batch;
    private Disposable timer;
    private Instant flushDueAt;
    private Mono<BatchResult> inFlight;
    private boolean closed;

    @Builder
    public BatchAccumulator(String profileId, String profileName, QueueManager queueManager,
            SnapshotCache snapshotCache, SessionStorage storage, SwipeQueueProperties properties,
            Supplier<ResumeSettings> resumeSettings, BatchListener listener, QueueMetrics metrics,
            Scheduler scheduler) {
        this.profileId = profileId;
        this.profileName = profileName;
        this.queueManager = queueManager;
        this.snapshotCache = snapshotCache;
        this.storage = storage;
        this.properties = properties;
        this.resumeSettings = resumeSettings != null ? resumeSettings : ResumeSettings::none;
        this.listener = listener != null ? listener : BatchListener.NO_OP;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.batch = new PendingBatch(profileId);
    }

    /**
     * Record a right-swipe. Never performs network I/O.
     *
     * @return true when the job joined the batch, false for a duplicate or a job without URL
     */
    public boolean addSwipedJob(SwipedJob job) {
        String url = job.resolveUrl();
        if (url == null) {
            metrics.recordJobDropped(ErrorKind.INVALID_URL);
            notifyError(BatchError.dropped(ErrorKind.INVALID_URL, null, job.getTitle(),
                    "Job has neither an apply URL nor a listing URL"));
            return false;
        }

        Instant now = now();
        snapshotCache.cacheSwipedJob(JobSnapshot.fromSwipe(job, url, now));

        boolean added;
        boolean forceFlush;
        int size;
        synchronized (this) {
            if (closed) {
                log.warn("Swipe on {} ignored, accumulator of profile {} is closed", url, profileId);
                return false;
            }

            added = batch.add(PendingJob.from(job, url, now), now);
            if (added) {
                metrics.recordSwipe();
                persist();
            } else {
                log.debug("{} is already pending for profile {}", url, profileId);
            }

            size = batch.size();
            forceFlush = reachedCeiling(now);
            if (!forceFlush) {
                armTimer(properties.getDebounce());
            }
        }

        if (forceFlush) {
            log.info("Batch of profile {} reached its ceiling, flushing {} jobs early", profileId, size);
            flushAndReset();
        }
        return added;
    }

    /**
     * Submit every pending job now. A call while a flush is running joins that flush.
     * The flush starts immediately; subscribing to the result is only needed to observe it.
     */
    public Mono<BatchResult> flushAndReset() {
        Mono<BatchResult> flush;
        synchronized (this) {
            if (inFlight != null) {
                return inFlight;
            }
            cancelTimer();
            if (batch.isEmpty()) {
                return Mono.just(BatchResult.empty(profileId));
            }

            List<PendingJob> jobs = batch.drain();
            persist();
            ResumeSettings settings = currentResumeSettings();
            log.info("Flushing {} jobs for profile {}", jobs.size(), profileId);

            flush = Flux.fromIterable(jobs)
                    .concatMap(job -> submit(job, settings))
                    .collectList()
                    .map(this::complete)
                    .doFinally(signal -> clearInFlight())
                    .cache();
            inFlight = flush;
        }

        flush.subscribe(
                result -> log.debug("Flush of profile {} finished: {} sent, {} retained",
                        profileId, result.sent(), result.retained()),
                error -> log.error("Flush of profile {} failed: {}", profileId, error.getMessage(), error));
        return flush;
    }

    /**
     * Wait for a running flush, then flush whatever was swiped meanwhile.
     * Used when the profile goes out of scope.
     */
    public Mono<BatchResult> flushAll() {
        Mono<BatchResult> running;
        synchronized (this) {
            running = inFlight;
        }
        if (running == null) {
            return flushAndReset();
        }
        return running.then(Mono.defer(this::flushAndReset));
    }

    /**
     * Hydrate the batch persisted by a previous session. Flushes right away when its
     * debounce window already elapsed, otherwise arms the timer for the remaining time.
     */
    public void restore() {
        List<PendingJob> stored = storage.read(storageKey(), PENDING_JOBS_TYPE).orElse(List.of());
        if (stored.isEmpty()) {
            return;
        }

        Instant now = now();
        synchronized (this) {
            stored.stream()
                    .filter(job -> job.getUrl() != null && !job.getUrl().isBlank())
                    .forEach(job -> batch.add(job, job.getSwipedAt() != null ? job.getSwipedAt() : now));
            if (batch.isEmpty()) {
                return;
            }

            Instant newest = stored.stream()
                    .map(PendingJob::getSwipedAt)
                    .filter(Objects::nonNull)
                    .max(Comparator.naturalOrder())
                    .orElse(now);
            Duration remaining = Duration.between(now, newest.plus(properties.getDebounce()));
            if (!remaining.isNegative() && !remaining.isZero()) {
                log.info("Restored {} pending jobs for profile {}, flushing in {}s",
                        batch.size(), profileId, remaining.toSeconds());
                armTimer(remaining);
                return;
            }
            log.info("Restored {} pending jobs for profile {}, window elapsed, flushing now", batch.size(), profileId);
        }

        flushAndReset();
    }

    /**
     * Drop the pending batch without submitting it.
     */
    public synchronized void clearPendingJobs() {
        cancelTimer();
        List<PendingJob> dropped = batch.drain();
        storage.remove(storageKey());
        if (!dropped.isEmpty()) {
            log.info("Discarded {} pending jobs of profile {}", dropped.size(), profileId);
        }
    }

    public synchronized List<PendingJob> getPendingJobs() {
        return batch.getJobs();
    }

    public synchronized boolean hasPending() {
        return !batch.isEmpty();
    }

    /**
     * Time left before the debounce timer fires, empty when no timer is armed.
     */
    public synchronized Optional<Duration> timeUntilFlush() {
        if (timer == null || flushDueAt == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(now(), flushDueAt);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Stop the timer. Pending jobs stay persisted for the next session.
     */
    public synchronized void close() {
        closed = true;
        cancelTimer();
    }

    private Mono<Submission> submit(PendingJob job, ResumeSettings settings) {
        return queueManager.addJobToQueue(profileId, job.getUrl(), job.toDetails(), profileName, settings,
                        job.getAttempts())
                .onErrorResume(e -> Mono.just(QueueResult.failed(ErrorKind.NETWORK_ERROR, e.getMessage())))
                .map(result -> new Submission(job, result));
    }

    private BatchResult complete(List<Submission> submissions) {
        List<BatchError> errors = new ArrayList<>();
        List<PendingJob> retained = new ArrayList<>();
        int sent = 0;

        for (Submission submission : submissions) {
            PendingJob job = submission.job();
            QueueResult result = submission.result();
            if (result.success()) {
                sent++;
                continue;
            }

            ErrorKind kind = result.errorKind() != null ? result.errorKind() : ErrorKind.NETWORK_ERROR;
            if (!kind.isTransient()) {
                metrics.recordJobDropped(kind);
                errors.add(BatchError.dropped(kind, job.getUrl(), job.getTitle(), result.error()));
                continue;
            }

            // The queue manager counts sync failures too; its count wins when higher
            job.setAttempts(Math.max(job.getAttempts() + 1, result.attempts()));
            if (job.getAttempts() < properties.getMaxRetries()) {
                retained.add(job);
                errors.add(BatchError.retrying(kind, job.getUrl(), job.getTitle(), result.error()));
            } else {
                if (result.attempts() < properties.getMaxRetries()) {
                    queueManager.abandonPendingUrl(profileId, job.getUrl());
                }
                errors.add(BatchError.dropped(kind, job.getUrl(), job.getTitle(),
                        "Gave up after " + job.getAttempts() + " attempts: " + result.error()));
            }
        }

        Automation automation = sent > 0 ? queueManager.getAutomationForProfile(profileId).orElse(null) : null;

        synchronized (this) {
            if (!retained.isEmpty()) {
                batch.retain(retained, now());
                persist();
            }
            if (!batch.isEmpty() && !closed) {
                armTimer(properties.getDebounce());
            }
        }

        if (sent > 0) {
            metrics.recordBatchSent(sent);
            log.info("Queued {} jobs for profile {} on automation {}", sent, profileId,
                    automation != null ? automation.getId() : "?");
            notifySent(automation, sent);
        }
        errors.forEach(this::notifyError);

        return new BatchResult(profileId, automation, sent, retained.size(), List.copyOf(errors));
    }

    private boolean reachedCeiling(Instant now) {
        if (batch.size() >= properties.getMaxBatchSize()) {
            return true;
        }
        Instant armedAt = batch.getArmedAt();
        return armedAt != null && !now.isBefore(armedAt.plus(properties.getMaxBatchAge()));
    }

    private void armTimer(Duration delay) {
        cancelTimer();
        flushDueAt = now().plus(delay);
        timer = scheduler.schedule(this::onTimerExpired, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onTimerExpired() {
        synchronized (this) {
            // Forget the firing task so the flush does not cancel it
            timer = null;
            flushDueAt = null;
        }
        log.debug("Debounce window of profile {} elapsed", profileId);
        flushAndReset();
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.dispose();
            timer = null;
        }
        flushDueAt = null;
    }

    private synchronized void clearInFlight() {
        inFlight = null;
    }

    private ResumeSettings currentResumeSettings() {
        ResumeSettings settings = resumeSettings.get();
        return settings != null ? settings : ResumeSettings.none();
    }

    private void persist() {
        try {
            if (batch.isEmpty()) {
                storage.remove(storageKey());
            } else {
                storage.write(storageKey(), batch.getJobs());
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist pending batch of profile {}: {}", profileId, e.getMessage());
        }
    }

    private void notifySent(Automation automation, int jobCount) {
        try {
            listener.onBatchSent(automation, jobCount);
        } catch (RuntimeException e) {
            log.error("Batch listener failed on success of profile {}: {}", profileId, e.getMessage(), e);
        }
    }

    private void notifyError(BatchError error) {
        log.warn("Job {} of profile {} failed ({}{}): {}", error.jobUrl(), profileId, error.kind(),
                error.willRetry() ? ", will retry" : "", error.message());
        try {
            listener.onBatchError(error);
        } catch (RuntimeException e) {
            log.error("Batch listener failed on error of profile {}: {}", profileId, e.getMessage(), e);
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }

    private String storageKey() {
        return STORAGE_KEY_PREFIX + profileId;
    }
}
