package dev.fastapply.metrics;

import dev.fastapply.error.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the swipe queue.
 */
@Component
public class QueueMetrics {

    private static final String TAG_ENDPOINT = "endpoint";
    private static final String TAG_REASON = "reason";
    private final MeterRegistry registry;

    // Counters
    private final Counter swipesCounter;
    private final Counter batchesSentCounter;
    private final Counter jobsQueuedCounter;
    private final Counter automationsCreatedCounter;
    private final Counter workerErrorsCounter;

    // Timers (per worker endpoint)
    private final ConcurrentHashMap<String, Timer> endpointTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger pendingUrls = new AtomicInteger(0);
    private final AtomicInteger lastBatchSize = new AtomicInteger(0);

    public QueueMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.swipesCounter = Counter.builder("swipe_queue_swipes_total")
                .description("Right-swipes recorded into a pending batch")
                .register(registry);

        this.batchesSentCounter = Counter.builder("swipe_queue_batches_sent_total")
                .description("Batches submitted with at least one acknowledged job")
                .register(registry);

        this.jobsQueuedCounter = Counter.builder("swipe_queue_jobs_queued_total")
                .description("Job URLs acknowledged by the automation worker")
                .register(registry);

        this.automationsCreatedCounter = Counter.builder("swipe_queue_automations_created_total")
                .description("Automations created for profiles on first submission")
                .register(registry);

        this.workerErrorsCounter = Counter.builder("swipe_queue_worker_errors_total")
                .description("Failed calls to the automation worker")
                .register(registry);

        Gauge.builder("swipe_queue_pending_urls", pendingUrls, AtomicInteger::get)
                .description("URLs queued locally but not yet acknowledged")
                .register(registry);

        Gauge.builder("swipe_queue_last_batch_size", lastBatchSize, AtomicInteger::get)
                .description("Jobs acknowledged in the last batch")
                .register(registry);
    }

    /**
     * Get or create a timer for a worker endpoint.
     */
    public Timer getEndpointTimer(String endpoint) {
        return endpointTimers.computeIfAbsent(endpoint, name ->
                Timer.builder("swipe_queue_worker_request_duration")
                        .description("Latency of automation worker calls")
                        .tag(TAG_ENDPOINT, name)
                        .register(registry)
        );
    }

    public void recordSwipe() {
        swipesCounter.increment();
    }

    /**
     * Record a batch whose jobs were acknowledged.
     */
    public void recordBatchSent(int jobCount) {
        batchesSentCounter.increment();
        lastBatchSize.set(jobCount);
    }

    public void recordJobsQueued(int count) {
        jobsQueuedCounter.increment(count);
    }

    public void recordAutomationCreated() {
        automationsCreatedCounter.increment();
    }

    /**
     * Record a job that left the pipeline without being queued.
     */
    public void recordJobDropped(ErrorKind reason) {
        Counter.builder("swipe_queue_jobs_dropped_total")
                .tag(TAG_REASON, reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Record a failed call to the worker.
     */
    public void recordWorkerError(String endpoint) {
        workerErrorsCounter.increment();
        Counter.builder("swipe_queue_worker_errors_by_endpoint_total")
                .tag(TAG_ENDPOINT, endpoint)
                .register(registry)
                .increment();
    }

    public void recordWorkerLatency(String endpoint, long latencyMs) {
        getEndpointTimer(endpoint).record(Duration.ofMillis(latencyMs));
    }

    public void updatePendingUrls(int count) {
        pendingUrls.set(count);
    }
}
