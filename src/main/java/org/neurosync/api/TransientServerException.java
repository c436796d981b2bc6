package org.neurosync.api;

/**
 * Thrown when a gateway timeout (504) persists after the configured number of retries.
 */
public class TransientServerException extends AnnotationSyncException {

    private final int attempts;

    public TransientServerException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
