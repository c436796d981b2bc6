package org.neurosync.api;

/**
 * Thrown when a non-overwriting write targets an id that is already present in the
 * annotation cache.
 */
public class ConflictException extends AnnotationSyncException {

    private final String annotationId;

    public ConflictException(String annotationId) {
        super("Cannot overwrite existing annotation: " + annotationId);
        this.annotationId = annotationId;
    }

    public String getAnnotationId() {
        return annotationId;
    }
}
