package dev.fastapply.error;

/**
 * Failure taxonomy of the swipe queue.
 */
public enum ErrorKind {
    /** No profile selected when a swipe or flush was attempted. */
    NO_PROFILE(false),
    /** The job has neither an apply URL nor a listing URL. */
    INVALID_URL(false),
    /** Transient submission failure; retried on the next trigger. */
    NETWORK_ERROR(true),
    /** A cached automation points at a profile or automation that no longer exists. */
    STALE_PROFILE(true);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
