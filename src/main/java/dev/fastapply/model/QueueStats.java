package dev.fastapply.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-status counts of an automation's queue, as reported by the worker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueStats {
    private int pending;
    private int processing;
    private int completed;
    private int failed;
    private int skipped;
    private int total;

    public int getOutstanding() {
        return pending + processing;
    }
}
