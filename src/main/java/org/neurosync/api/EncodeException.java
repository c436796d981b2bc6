package org.neurosync.api;

/**
 * Thrown when no encoder is able to turn an annotation into a backend entry for a write.
 */
public class EncodeException extends AnnotationSyncException {

    public EncodeException(String message) {
        super(message);
    }
}
