package org.neurosync.api;

/**
 * Base class of every failure surfaced by the annotation synchronization layer.
 * <p>
 * Asynchronous operations complete their futures exceptionally with a subclass of this
 * exception. Cancellation is reported separately through
 * {@link java.util.concurrent.CancellationException} and never through this hierarchy.
 */
public class AnnotationSyncException extends RuntimeException {

    public AnnotationSyncException(String message) {
        super(message);
    }

    public AnnotationSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
