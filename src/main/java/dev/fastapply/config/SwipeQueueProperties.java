package dev.fastapply.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tuning of the swipe queue.
 * Loaded from application.yml under 'swipe-queue' prefix; defaults match the shipped constants.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "swipe-queue")
public class SwipeQueueProperties {

    private String workerBaseUrl = "http://localhost:3000";
    private String apiToken;

    /** Storage namespace of the session, one per signed-in user. */
    private String namespace = "default";

    /** Inactivity window after which a pending batch is sent. */
    private Duration debounce = Duration.ofMillis(120_000);

    /** Hard ceilings forcing a flush under continuous swiping. */
    private int maxBatchSize = 25;
    private Duration maxBatchAge = Duration.ofMinutes(10);

    /** Submission attempts per unsent job before it is dropped. */
    private int maxRetries = 3;

    /** Acknowledged URLs remembered per automation for local deduplication, oldest evicted first. */
    private int maxAcknowledgedUrls = 1000;

    private boolean syncOnInitialize = true;
    private boolean reconcileOnStartup = true;

    /** Profiles that still exist; cached automations of any other profile are pruned on reconcile. */
    private List<String> knownProfiles = new ArrayList<>();

    private Http http = new Http();
    private Snapshot snapshot = new Snapshot();
    private AutomationDefaults automation = new AutomationDefaults();

    @Data
    public static class Http {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(10);
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Snapshot {
        private int capacity = 500;
        private Duration maxAge = Duration.ofDays(30);
    }

    @Data
    public static class AutomationDefaults {
        private String scheduleType = "daily";
        private String scheduleTime = "09:00";
        private int maxApplicationsPerDay = 50;
    }
}
