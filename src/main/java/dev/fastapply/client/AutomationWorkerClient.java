package dev.fastapply.client;

import dev.fastapply.model.Automation;
import dev.fastapply.model.QueueEntry;
import dev.fastapply.model.QueueEntryStatus;
import dev.fastapply.model.QueueStats;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Remote automation worker that applies to queued jobs.
 * Failures surface as {@link dev.fastapply.error.QueueException}.
 */
public interface AutomationWorkerClient {

    /**
     * Create an automation; the request must carry at least one URL.
     */
    Mono<Automation> createAutomation(CreateAutomationRequest request);

    /**
     * Find the active direct-URL automations of a profile.
     */
    Flux<Automation> findAutomations(String profileId);

    /**
     * Append URLs to an automation. The worker ignores URLs it already holds.
     */
    Mono<AddUrlsResponse> addUrls(String automationId, AddUrlsRequest request);

    Mono<QueueStats> getQueueStats(String automationId);

    /**
     * List the queue entries of an automation, optionally filtered by status.
     */
    Flux<QueueEntry> getQueueEntries(String automationId, QueueEntryStatus status);
}
