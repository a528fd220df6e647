package dev.fastapply.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param added      URLs that became new queue entries
 * @param duplicates URLs the automation already held
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AddUrlsResponse(int added, int duplicates) {
}
