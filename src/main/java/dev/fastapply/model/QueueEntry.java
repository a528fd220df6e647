package dev.fastapply.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueEntry {
    private String id;
    private String automationId;
    private String jobUrl;
    private String jobTitle;

    @JsonAlias("company")
    private String companyName;

    private String platform;
    private QueueEntryStatus status;

    @JsonAlias("createdAt")
    private Instant enqueuedAt;
}
