package com.livestanding.snapshot;

/**
 * Thrown when a payload cannot be turned into a {@link MatchSnapshot}.
 * The dispatcher drops the message and carries on.
 */
public class SnapshotValidationException extends RuntimeException {

    public SnapshotValidationException(String message) {
        super(message);
    }

    public SnapshotValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
