package dev.fastapply.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Right-swiped jobs of one profile not yet handed to the queue manager.
 * Jobs keep swipe order and a URL appears at most once.
 */
public class PendingBatch {

    @Getter
    private final String profileId;

    private final LinkedHashMap<String, PendingJob> jobs = new LinkedHashMap<>();

    // When the oldest job still waiting entered the batch
    @Getter
    private Instant armedAt;

    public PendingBatch(String profileId) {
        this.profileId = profileId;
    }

    /**
     * @return false when the URL is already pending
     */
    public boolean add(PendingJob job, Instant now) {
        if (jobs.containsKey(job.getUrl())) {
            return false;
        }
        if (jobs.isEmpty()) {
            armedAt = now;
        }
        jobs.put(job.getUrl(), job);
        return true;
    }

    /**
     * Take every pending job, leaving the batch empty.
     */
    public List<PendingJob> drain() {
        List<PendingJob> drained = new ArrayList<>(jobs.values());
        jobs.clear();
        armedAt = null;
        return drained;
    }

    /**
     * Put unsent jobs back in front of anything swiped since they were drained.
     * The batch stays armed since its oldest swipe, so the age ceiling still applies.
     */
    public void retain(List<PendingJob> unsent, Instant now) {
        if (unsent.isEmpty()) {
            return;
        }
        LinkedHashMap<String, PendingJob> merged = new LinkedHashMap<>();
        unsent.forEach(job -> merged.put(job.getUrl(), job));
        jobs.forEach(merged::putIfAbsent);
        jobs.clear();
        jobs.putAll(merged);
        armedAt = jobs.values().stream()
                .map(PendingJob::getSwipedAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(now);
    }

    public List<PendingJob> getJobs() {
        return List.copyOf(jobs.values());
    }

    public boolean contains(String url) {
        return jobs.containsKey(url);
    }

    public int size() {
        return jobs.size();
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }
}
