package dev.fastapply.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A right-swiped job waiting in a profile's batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingJob {
    private String jobId;
    private String url;
    private String title;
    private String company;
    private String platform;
    private Instant swipedAt;

    // Failed submission attempts so far
    private int attempts;

    public static PendingJob from(SwipedJob job, String url, Instant swipedAt) {
        return PendingJob.builder()
                .jobId(job.getId())
                .url(url)
                .title(job.getTitle())
                .company(job.getCompany())
                .platform(job.getSource())
                .swipedAt(swipedAt)
                .build();
    }

    public JobDetails toDetails() {
        return new JobDetails(title, company, platform);
    }
}
