package dev.fastapply.model;

import java.time.Instant;

/**
 * A single swipe as seen by the queue. Never persisted.
 */
public record SwipeEvent(
        String jobId,
        String jobUrl,
        SwipeDirection direction,
        String profileId,
        Instant timestamp) {

    public boolean isRightSwipe() {
        return direction == SwipeDirection.RIGHT;
    }
}
