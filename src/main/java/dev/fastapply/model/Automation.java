package dev.fastapply.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Server-side aggregate of queued job URLs for one profile.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Automation {
    private String id;
    private String name;

    @JsonProperty("jobProfileId")
    private String profileId;

    private String applicationMode;

    @JsonProperty("isActive")
    private boolean active;

    private Instant createdAt;
}
