package dev.fastapply.service;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.fastapply.client.AddUrlsRequest;
import dev.fastapply.client.AutomationWorkerClient;
import dev.fastapply.client.CreateAutomationRequest;
import dev.fastapply.client.UrlInput;
import dev.fastapply.config.SwipeQueueProperties;
import dev.fastapply.error.ErrorKind;
import dev.fastapply.error.QueueException;
import dev.fastapply.metrics.QueueMetrics;
import dev.fastapply.model.Automation;
import dev.fastapply.model.JobDetails;
import dev.fastapply.model.PendingUrlEntry;
import dev.fastapply.model.QueueEntry;
import dev.fastapply.model.QueueEntryStatus;
import dev.fastapply.model.QueueStats;
import dev.fastapply.model.ResumeSettings;
import dev.fastapply.store.SessionStorage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns job URLs into queue entries of the profile's automation on the worker.
 * <p>
 * Every URL is tracked locally as pending before any network call and only
 * forgotten once the worker acknowledged it, so a failed or interrupted
 * submission can be replayed by {@link #syncPendingUrls()}. URLs acknowledged
 * for an automation are remembered, which makes resubmitting them a no-op.
 * All state is persisted through the session storage after every change.
 */
@Slf4j
public class QueueManager {

    static final String PROFILE_AUTOMATION_MAP = "automation_profile_map";
    static final String PENDING_URLS = "automation_pending_urls";
    static final String ACKNOWLEDGED_URLS = "automation_acknowledged_urls";
    static final String LAST_SYNC = "automation_last_sync";

    private static final TypeReference<Map<String, Automation>> AUTOMATION_MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<PendingUrlEntry>> PENDING_URLS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Set<String>>> ACKNOWLEDGED_TYPE = new TypeReference<>() {
    };

    /**
     * Outcome of queuing one URL.
     *
     * @param attempts failed submissions of the URL so far; at the retry cap the URL was given up
     */
    public record QueueResult(boolean success, String automationId, ErrorKind errorKind, String error,
            int attempts) {
        public static QueueResult queued(String automationId) {
            return new QueueResult(true, automationId, null, null, 0);
        }

        public static QueueResult failed(ErrorKind kind, String error) {
            return failed(kind, error, 0);
        }

        public static QueueResult failed(ErrorKind kind, String error, int attempts) {
            return new QueueResult(false, null, kind, error, attempts);
        }
    }

    /**
     * Outcome of one pass over the pending URLs.
     *
     * @param droppedUrls URLs given up on after exhausting their retries
     */
    public record SyncResult(int submitted, int skipped, int failed, List<String> droppedUrls) {
        public static final SyncResult EMPTY = new SyncResult(0, 0, 0, List.of());

        static SyncResult ofSubmitted() {
            return new SyncResult(1, 0, 0, List.of());
        }

        static SyncResult ofSkipped() {
            return new SyncResult(0, 1, 0, List.of());
        }

        static SyncResult ofFailed() {
            return new SyncResult(0, 0, 1, List.of());
        }

        static SyncResult ofDropped(String url) {
            return new SyncResult(0, 0, 0, List.of(url));
        }

        SyncResult plus(SyncResult other) {
            List<String> dropped = new ArrayList<>(droppedUrls);
            dropped.addAll(other.droppedUrls);
            return new SyncResult(submitted + other.submitted, skipped + other.skipped,
                    failed + other.failed, List.copyOf(dropped));
        }
    }

    /**
     * Automation resolved for a profile; initialUrl is set when it was just created with that URL.
     */
    private record Resolution(Automation automation, String initialUrl) {
    }

    private final AutomationWorkerClient client;
    private final SessionStorage storage;
    private final SwipeQueueProperties properties;
    private final QueueMetrics metrics;
    private final Clock clock;

    private final Map<String, Automation> automationsByProfile = new LinkedHashMap<>();
    private final List<PendingUrlEntry> pendingUrls = new ArrayList<>();
    private final Map<String, Set<String>> acknowledgedUrls = new HashMap<>();
    private final Map<String, Mono<Resolution>> resolving = new HashMap<>();
    private Mono<SyncResult> syncInFlight;
    private boolean initialized;

    public QueueManager(AutomationWorkerClient client, SessionStorage storage, SwipeQueueProperties properties,
            QueueMetrics metrics, Clock clock) {
        this.client = client;
        this.storage = storage;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Hydrate cached automations and unacknowledged URLs from local storage.
     * Safe to call any number of times; only the first call reads storage.
     */
    public void initialize() {
        int toSync;
        synchronized (this) {
            if (initialized) {
                return;
            }
            loadState();
            initialized = true;
            toSync = properties.isSyncOnInitialize() ? pendingUrls.size() : 0;
        }

        if (toSync > 0) {
            log.info("Resubmitting {} unacknowledged URLs from a previous session", toSync);
            syncPendingUrls().subscribe(
                    result -> log.info("Background sync finished: {} submitted, {} still pending",
                            result.submitted(), getPendingUrlsCount()),
                    error -> log.warn("Background sync failed: {}", error.getMessage()));
        }
    }

    /**
     * Cached automation of a profile. Never contacts the worker and never creates one.
     */
    public Optional<Automation> getAutomationForProfile(String profileId) {
        initialize();
        synchronized (this) {
            return Optional.ofNullable(automationsByProfile.get(profileId));
        }
    }

    public List<Automation> getCachedAutomations() {
        initialize();
        synchronized (this) {
            return List.copyOf(automationsByProfile.values());
        }
    }

    public Mono<QueueResult> addJobToQueue(String profileId, String jobUrl, JobDetails jobDetails, String profileName) {
        return addJobToQueue(profileId, jobUrl, jobDetails, profileName, ResumeSettings.none());
    }

    /**
     * Queue a job URL on the profile's automation, creating the automation on first use.
     * Never errors: failures come back as a failed {@link QueueResult}.
     *
     * @param jobUrl already resolved URL (apply URL, or listing URL as fallback)
     */
    public Mono<QueueResult> addJobToQueue(String profileId, String jobUrl, JobDetails jobDetails,
            String profileName, ResumeSettings resumeSettings) {
        return addJobToQueue(profileId, jobUrl, jobDetails, profileName, resumeSettings, 0);
    }

    /**
     * Resubmit a job the caller already tried before. Failed attempts count against one budget
     * per URL, shared with {@link #syncPendingUrls()}; a URL that failed before and is no longer
     * pending was given up and is not sent again.
     *
     * @param failedAttempts attempts of this job the caller saw fail
     */
    public Mono<QueueResult> addJobToQueue(String profileId, String jobUrl, JobDetails jobDetails,
            String profileName, ResumeSettings resumeSettings, int failedAttempts) {
        if (!isValidId(profileId)) {
            return Mono.just(QueueResult.failed(ErrorKind.NO_PROFILE, "No profile selected"));
        }
        if (jobUrl == null || jobUrl.isBlank()) {
            return Mono.just(QueueResult.failed(ErrorKind.INVALID_URL, "Job has no application URL"));
        }

        return Mono.defer(() -> {
            initialize();
            String url = jobUrl.trim();
            PendingUrlEntry entry;
            synchronized (this) {
                Automation automation = automationsByProfile.get(profileId);
                if (automation != null && isAcknowledged(automation.getId(), url)) {
                    log.debug("{} is already queued on automation {}", url, automation.getId());
                    return Mono.just(QueueResult.queued(automation.getId()));
                }
                if (failedAttempts > 0 && findPending(profileId, url) == null) {
                    log.info("{} of profile {} was given up after repeated failures, not resubmitting", url, profileId);
                    return Mono.just(QueueResult.failed(ErrorKind.NETWORK_ERROR,
                            "Gave up after repeated failures", Math.max(failedAttempts, properties.getMaxRetries())));
                }
                entry = trackPending(profileId, profileName, url, jobDetails, resumeSettings, failedAttempts);
            }
            return submit(entry);
        });
    }

    /**
     * Current queue counts of an automation, read from the worker on every call.
     *
     * @return empty for an invalid automation id
     */
    public Mono<QueueStats> getQueueStats(String automationId) {
        if (!isValidId(automationId)) {
            log.warn("getQueueStats called with invalid id: {}", automationId);
            return Mono.empty();
        }
        return client.getQueueStats(automationId)
                .doOnError(e -> log.warn("Failed to get queue stats for {}: {}", automationId, e.getMessage()));
    }

    public Flux<QueueEntry> getQueueEntries(String automationId, QueueEntryStatus status) {
        if (!isValidId(automationId)) {
            log.warn("getQueueEntries called with invalid id: {}", automationId);
            return Flux.empty();
        }
        return client.getQueueEntries(automationId, status);
    }

    /**
     * Number of URLs queued locally that the worker has not acknowledged yet.
     */
    public int getPendingUrlsCount() {
        initialize();
        synchronized (this) {
            return pendingUrls.size();
        }
    }

    public List<PendingUrlEntry> getPendingUrls() {
        initialize();
        synchronized (this) {
            return List.copyOf(pendingUrls);
        }
    }

    /**
     * Resubmit every unacknowledged URL once. Acknowledged URLs are skipped, URLs past the
     * retry cap are dropped. Concurrent calls share the pass already running.
     */
    public Mono<SyncResult> syncPendingUrls() {
        return Mono.defer(() -> {
            initialize();
            synchronized (this) {
                if (syncInFlight != null) {
                    return syncInFlight;
                }
                if (pendingUrls.isEmpty()) {
                    return Mono.just(SyncResult.EMPTY);
                }

                List<PendingUrlEntry> snapshot = List.copyOf(pendingUrls);
                log.info("Syncing {} pending URLs", snapshot.size());

                Mono<SyncResult> pass = Flux.fromIterable(snapshot)
                        .concatMap(this::syncEntry)
                        .reduce(SyncResult.EMPTY, SyncResult::plus)
                        .doOnNext(this::recordSync)
                        .doFinally(signal -> finishSync())
                        .cache();
                syncInFlight = pass;
                return pass;
            }
        });
    }

    /**
     * Forget cached automations and pending URLs of profiles that no longer exist.
     *
     * @return number of automation references removed
     */
    public int cleanupInvalidProfiles(Collection<String> validProfileIds) {
        initialize();
        Set<String> valid = new HashSet<>(validProfileIds);

        synchronized (this) {
            int pendingBefore = pendingUrls.size();
            pendingUrls.removeIf(entry -> {
                boolean stale = !valid.contains(entry.getProfileId());
                if (stale) {
                    log.debug("Removing pending URL {} of invalid profile {}", entry.getUrl(), entry.getProfileId());
                }
                return stale;
            });

            int removedAutomations = 0;
            Iterator<Map.Entry<String, Automation>> it = automationsByProfile.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Automation> cached = it.next();
                if (!valid.contains(cached.getKey())) {
                    log.debug("Removing cached automation {} of invalid profile {}",
                            cached.getValue().getId(), cached.getKey());
                    acknowledgedUrls.remove(cached.getValue().getId());
                    it.remove();
                    removedAutomations++;
                }
            }

            if (removedAutomations > 0 || pendingUrls.size() != pendingBefore) {
                saveState();
                log.info("Cleaned up {} stale automation references and {} pending URLs",
                        removedAutomations, pendingBefore - pendingUrls.size());
            }
            return removedAutomations;
        }
    }

    /**
     * Wipe every piece of local automation state, e.g. on sign-out.
     */
    public synchronized void clearCache() {
        automationsByProfile.clear();
        pendingUrls.clear();
        acknowledgedUrls.clear();
        resolving.clear();
        initialized = false;
        storage.remove(PROFILE_AUTOMATION_MAP);
        storage.remove(PENDING_URLS);
        storage.remove(ACKNOWLEDGED_URLS);
        storage.remove(LAST_SYNC);
        metrics.updatePendingUrls(0);
    }

    /**
     * Stop retrying a URL the caller gave up on.
     *
     * @return false when the URL was not pending anymore
     */
    public synchronized boolean abandonPendingUrl(String profileId, String jobUrl) {
        PendingUrlEntry entry = jobUrl != null ? findPending(profileId, jobUrl.trim()) : null;
        if (entry == null) {
            return false;
        }
        removePending(entry);
        metrics.recordJobDropped(ErrorKind.NETWORK_ERROR);
        log.warn("Gave up on {} for profile {}", entry.getUrl(), profileId);
        return true;
    }

    synchronized Set<String> acknowledgedUrlsOf(String automationId) {
        return Set.copyOf(acknowledgedUrls.getOrDefault(automationId, Set.of()));
    }

    private Mono<QueueResult> submit(PendingUrlEntry entry) {
        return resolveAutomation(entry)
                .flatMap(resolution -> {
                    Automation automation = resolution.automation();
                    if (entry.getUrl().equals(resolution.initialUrl())) {
                        return Mono.just(automation);
                    }
                    AddUrlsRequest request = AddUrlsRequest.of(List.of(toUrlInput(entry)), entry.getResumeSettings());
                    return client.addUrls(automation.getId(), request).thenReturn(automation);
                })
                .map(automation -> {
                    acknowledge(entry, automation);
                    return QueueResult.queued(automation.getId());
                })
                .onErrorResume(QueueException.class, e -> Mono.just(onSubmitFailure(entry, e)));
    }

    /**
     * Cached automation of the entry's profile, else the worker's existing one, else a new one
     * created with the entry's URL. Concurrent resolutions for one profile share a single call.
     */
    private Mono<Resolution> resolveAutomation(PendingUrlEntry entry) {
        String profileId = entry.getProfileId();
        synchronized (this) {
            Automation cached = automationsByProfile.get(profileId);
            if (cached != null) {
                return Mono.just(new Resolution(cached, null));
            }
            Mono<Resolution> inFlight = resolving.get(profileId);
            if (inFlight != null) {
                return inFlight;
            }

            Mono<Resolution> shared = client.findAutomations(profileId)
                    .filter(automation -> isValidId(automation.getId()))
                    .next()
                    .map(existing -> {
                        log.info("Reusing automation {} for profile {}", existing.getId(), profileId);
                        return new Resolution(existing, null);
                    })
                    .switchIfEmpty(Mono.defer(() -> createAutomation(entry)))
                    .doOnNext(resolution -> rememberAutomation(profileId, resolution.automation()))
                    .doFinally(signal -> forgetResolution(profileId))
                    .cache();
            resolving.put(profileId, shared);
            return shared;
        }
    }

    private Mono<Resolution> createAutomation(PendingUrlEntry entry) {
        ResumeSettings settings = entry.getResumeSettings() != null ? entry.getResumeSettings() : ResumeSettings.none();
        SwipeQueueProperties.AutomationDefaults defaults = properties.getAutomation();
        String name = entry.getProfileName() != null && !entry.getProfileName().isBlank()
                ? entry.getProfileName() + " - Mobile Swipe Queue"
                : "Mobile Swipe Queue - " + LocalDate.now(clock);

        CreateAutomationRequest request = CreateAutomationRequest.builder()
                .name(name)
                .jobProfileId(entry.getProfileId())
                .applicationMode(CreateAutomationRequest.DIRECT_URLS)
                .scheduleType(defaults.getScheduleType())
                .scheduleTime(defaults.getScheduleTime())
                .active(true)
                .maxApplicationsPerDay(defaults.getMaxApplicationsPerDay())
                .jobUrls(List.of(entry.getUrl()))
                .useTailoredResume(settings.useTailoredResume())
                .resumeType(settings.useTailoredResume() ? settings.resumeType() : null)
                .resumeTemplate(settings.useTailoredResume() ? settings.resumeTemplate() : null)
                .build();

        log.info("Creating automation '{}' for profile {}", name, entry.getProfileId());
        return client.createAutomation(request)
                .filter(created -> isValidId(created.getId()))
                .switchIfEmpty(Mono.error(() -> new QueueException(ErrorKind.NETWORK_ERROR,
                        "Worker returned an automation without a valid id")))
                .map(created -> {
                    if (created.getProfileId() == null) {
                        created.setProfileId(entry.getProfileId());
                    }
                    metrics.recordAutomationCreated();
                    return new Resolution(created, entry.getUrl());
                });
    }

    private QueueResult onSubmitFailure(PendingUrlEntry entry, QueueException e) {
        if (e.getKind() == ErrorKind.STALE_PROFILE) {
            dropAutomationReference(entry.getProfileId());
        }
        log.warn("Failed to queue {} for profile {}: {}", entry.getUrl(), entry.getProfileId(), e.getMessage());

        // A stale reference is repaired locally; for the caller it is just a failed attempt
        ErrorKind reported = e.getKind() == ErrorKind.STALE_PROFILE ? ErrorKind.NETWORK_ERROR : e.getKind();
        int attempts = reported.isTransient() ? countFailure(entry) : 0;
        return QueueResult.failed(reported, e.getMessage(), attempts);
    }

    private Mono<SyncResult> syncEntry(PendingUrlEntry entry) {
        synchronized (this) {
            if (pendingUrls.stream().noneMatch(pending -> pending == entry)) {
                return Mono.just(SyncResult.ofSkipped());
            }

            Automation automation = automationsByProfile.get(entry.getProfileId());
            if (automation != null && isAcknowledged(automation.getId(), entry.getUrl())) {
                removePending(entry);
                return Mono.just(SyncResult.ofSkipped());
            }

            if (entry.getRetryCount() >= properties.getMaxRetries()) {
                removePending(entry);
                metrics.recordJobDropped(ErrorKind.NETWORK_ERROR);
                log.warn("Dropping {} for profile {} after {} failed attempts",
                        entry.getUrl(), entry.getProfileId(), entry.getRetryCount());
                return Mono.just(SyncResult.ofDropped(entry.getUrl()));
            }
        }

        return submit(entry).map(result -> {
            if (result.success()) {
                return SyncResult.ofSubmitted();
            }
            return result.attempts() >= properties.getMaxRetries()
                    ? SyncResult.ofDropped(entry.getUrl())
                    : SyncResult.ofFailed();
        });
    }

    private synchronized PendingUrlEntry trackPending(String profileId, String profileName, String url,
            JobDetails details, ResumeSettings resumeSettings, int failedAttempts) {
        PendingUrlEntry existing = findPending(profileId, url);
        if (existing != null) {
            // Latest flush decides the settings the URL is submitted with
            existing.setResumeSettings(resumeSettings);
            existing.setProfileName(profileName);
            existing.setRetryCount(Math.max(existing.getRetryCount(), failedAttempts));
            return existing;
        }

        PendingUrlEntry entry = PendingUrlEntry.builder()
                .profileId(profileId)
                .profileName(profileName)
                .url(url)
                .details(details != null ? details : JobDetails.empty())
                .resumeSettings(resumeSettings)
                .enqueuedAt(clock.instant())
                .retryCount(failedAttempts)
                .build();
        pendingUrls.add(entry);
        saveState();
        return entry;
    }

    private synchronized void acknowledge(PendingUrlEntry entry, Automation automation) {
        Set<String> acknowledged = acknowledgedUrls.computeIfAbsent(automation.getId(), id -> new LinkedHashSet<>());
        acknowledged.add(entry.getUrl());
        trimAcknowledged(acknowledged);
        pendingUrls.removeIf(pending -> pending.matches(entry.getProfileId(), entry.getUrl()));
        saveState();
        metrics.recordJobsQueued(1);
        log.debug("Queued {} on automation {}", entry.getUrl(), automation.getId());
    }

    private synchronized void rememberAutomation(String profileId, Automation automation) {
        automationsByProfile.put(profileId, automation);
        saveState();
    }

    private synchronized void forgetResolution(String profileId) {
        resolving.remove(profileId);
    }

    private synchronized void dropAutomationReference(String profileId) {
        Automation removed = automationsByProfile.remove(profileId);
        if (removed != null) {
            acknowledgedUrls.remove(removed.getId());
            saveState();
            log.warn("Automation {} of profile {} no longer exists, dropped cached reference",
                    removed.getId(), profileId);
        }
    }

    /**
     * Count a failed submission; the URL is given up once it reaches the retry cap.
     *
     * @return failed attempts so far
     */
    private synchronized int countFailure(PendingUrlEntry entry) {
        int attempts = entry.getRetryCount() + 1;
        entry.setRetryCount(attempts);
        if (attempts >= properties.getMaxRetries()) {
            pendingUrls.removeIf(pending -> pending == entry);
            metrics.recordJobDropped(ErrorKind.NETWORK_ERROR);
            log.warn("Dropping {} for profile {} after {} failed attempts",
                    entry.getUrl(), entry.getProfileId(), attempts);
        }
        saveState();
        return attempts;
    }

    private PendingUrlEntry findPending(String profileId, String url) {
        for (PendingUrlEntry pending : pendingUrls) {
            if (pending.matches(profileId, url)) {
                return pending;
            }
        }
        return null;
    }

    // Oldest first; the worker deduplicates whatever falls out of the set
    private void trimAcknowledged(Set<String> acknowledged) {
        Iterator<String> oldest = acknowledged.iterator();
        while (acknowledged.size() > properties.getMaxAcknowledgedUrls() && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    private synchronized void removePending(PendingUrlEntry entry) {
        pendingUrls.removeIf(pending -> pending == entry);
        saveState();
    }

    private synchronized void finishSync() {
        syncInFlight = null;
    }

    private void recordSync(SyncResult result) {
        log.info("Pending URL sync: {} submitted, {} skipped, {} failed, {} dropped",
                result.submitted(), result.skipped(), result.failed(), result.droppedUrls().size());
        try {
            storage.write(LAST_SYNC, clock.instant());
        } catch (RuntimeException e) {
            log.error("Failed to record sync time: {}", e.getMessage());
        }
    }

    private boolean isAcknowledged(String automationId, String url) {
        Set<String> urls = acknowledgedUrls.get(automationId);
        return urls != null && urls.contains(url);
    }

    private void loadState() {
        storage.read(PROFILE_AUTOMATION_MAP, AUTOMATION_MAP_TYPE).ifPresent(stored -> {
            stored.forEach((profileId, automation) -> {
                if (automation != null && isValidId(automation.getId())) {
                    automationsByProfile.put(profileId, automation);
                } else {
                    log.warn("Removing invalid cached automation for profile {}", profileId);
                }
            });
            if (automationsByProfile.size() != stored.size()) {
                saveState();
            }
        });

        storage.read(PENDING_URLS, PENDING_URLS_TYPE).ifPresent(stored -> stored.stream()
                .filter(entry -> isValidId(entry.getProfileId()) && entry.getUrl() != null && !entry.getUrl().isBlank())
                .forEach(pendingUrls::add));

        storage.read(ACKNOWLEDGED_URLS, ACKNOWLEDGED_TYPE).ifPresent(stored ->
                stored.forEach((automationId, urls) -> {
                    Set<String> acknowledged = new LinkedHashSet<>(urls);
                    trimAcknowledged(acknowledged);
                    acknowledgedUrls.put(automationId, acknowledged);
                }));

        metrics.updatePendingUrls(pendingUrls.size());
        log.debug("Loaded {} cached automations and {} pending URLs", automationsByProfile.size(), pendingUrls.size());
    }

    private void saveState() {
        try {
            storage.write(PROFILE_AUTOMATION_MAP, automationsByProfile);
            storage.write(PENDING_URLS, pendingUrls);
            storage.write(ACKNOWLEDGED_URLS, acknowledgedUrls);
        } catch (RuntimeException e) {
            log.error("Failed to save automation state: {}", e.getMessage());
        }
        metrics.updatePendingUrls(pendingUrls.size());
    }

    private UrlInput toUrlInput(PendingUrlEntry entry) {
        JobDetails details = entry.getDetails() != null ? entry.getDetails() : JobDetails.empty();
        String platform = details.platform() != null && !details.platform().isBlank()
                ? details.platform()
                : detectPlatform(entry.getUrl());
        return new UrlInput(entry.getUrl(), details.title(), details.company(), platform);
    }

    /**
     * Guess the applicant tracking system from a job URL.
     */
    static String detectPlatform(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("rippling.com")) return "rippling";
        if (lower.contains("ashbyhq.com")) return "ashby";
        if (lower.contains("workable.com")) return "workable";
        if (lower.contains("greenhouse.io")) return "greenhouse";
        if (lower.contains("lever.co")) return "lever";
        if (lower.contains("workday.com")) return "workday";
        if (lower.contains("linkedin.com")) return "linkedin";
        if (lower.contains("indeed.com")) return "indeed";
        return "other";
    }

    static boolean isValidId(String id) {
        return id != null && !id.isBlank() && !"undefined".equals(id) && !"null".equals(id);
    }
}
