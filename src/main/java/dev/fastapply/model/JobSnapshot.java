package dev.fastapply.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Locally cached job metadata. Advisory only: server data always wins.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobSnapshot {
    private String jobUrl;
    private String title;
    private String company;
    private String location;
    private String salary;
    private String platform;
    private Instant cachedAt;

    public static JobSnapshot fromSwipe(SwipedJob job, String url, Instant now) {
        return JobSnapshot.builder()
                .jobUrl(url)
                .title(job.getTitle())
                .company(job.getCompany())
                .location(job.getLocation())
                .salary(job.getSalary())
                .platform(job.getSource())
                .cachedAt(now)
                .build();
    }
}
