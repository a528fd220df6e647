package dev.fastapply.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Job posting as handed over by the swipe deck.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwipedJob {
    private String id;
    private String title;
    private String company;
    private String location;
    private String salary;
    private String source; // board the posting came from (LinkedIn, Lever, ...)

    private String applyUrl;
    private String listingUrl;

    /**
     * URL to queue: the apply URL when present, otherwise the listing URL.
     *
     * @return trimmed URL, or null when the job carries neither
     */
    public String resolveUrl() {
        if (applyUrl != null && !applyUrl.isBlank()) {
            return applyUrl.trim();
        }
        if (listingUrl != null && !listingUrl.isBlank()) {
            return listingUrl.trim();
        }
        return null;
    }
}
