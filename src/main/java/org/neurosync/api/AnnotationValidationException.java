package org.neurosync.api;

/**
 * Thrown for malformed input: an unrecognized annotation id, a description sentinel that is
 * not valid JSON, a missing positional field or an unparseable source URL.
 * Never retried.
 */
public class AnnotationValidationException extends AnnotationSyncException {

    public AnnotationValidationException(String message) {
        super(message);
    }

    public AnnotationValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
