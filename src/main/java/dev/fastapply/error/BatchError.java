package dev.fastapply.error;

/**
 * A failed job reported through the batch listener.
 *
 * @param willRetry true when the job stays in the batch for the next flush
 */
public record BatchError(ErrorKind kind, String jobUrl, String jobTitle, String message, boolean willRetry) {

    public static BatchError dropped(ErrorKind kind, String jobUrl, String jobTitle, String message) {
        return new BatchError(kind, jobUrl, jobTitle, message, false);
    }

    public static BatchError retrying(ErrorKind kind, String jobUrl, String jobTitle, String message) {
        return new BatchError(kind, jobUrl, jobTitle, message, true);
    }
}
