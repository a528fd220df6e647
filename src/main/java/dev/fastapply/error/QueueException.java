package dev.fastapply.error;

import lombok.Getter;

/**
 * Raised by the worker client and by validation; the queue manager turns it
 * into a failed {@code QueueResult} so it never reaches the swipe path.
 */
@Getter
public class QueueException extends RuntimeException {

    private final ErrorKind kind;

    public QueueException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueueException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
