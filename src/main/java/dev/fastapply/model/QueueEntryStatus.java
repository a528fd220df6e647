package dev.fastapply.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Lifecycle of a queue entry. Owned by the worker; the client only observes it.
 */
public enum QueueEntryStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("processing")
    PROCESSING,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("failed")
    FAILED,
    @JsonProperty("skipped")
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
