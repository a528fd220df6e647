package dev.fastapply.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateAutomationRequest(
        String name,
        String jobProfileId,
        String applicationMode,
        String scheduleType,
        String scheduleTime,
        @JsonProperty("isActive") boolean active,
        int maxApplicationsPerDay,
        List<String> jobUrls,
        boolean useTailoredResume,
        String resumeType,
        String resumeTemplate) {

    public static final String DIRECT_URLS = "direct_urls";
}
