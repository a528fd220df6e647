package dev.fastapply.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A URL handed to the queue manager that the worker has not acknowledged yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingUrlEntry {
    private String profileId;
    private String profileName;
    private String url;
    private JobDetails details;
    private ResumeSettings resumeSettings;
    private Instant enqueuedAt;
    private int retryCount;

    public boolean matches(String otherProfileId, String otherUrl) {
        return profileId.equals(otherProfileId) && url.equals(otherUrl);
    }
}
