package org.neurosync.api;

/**
 * Thrown when the session user is not allowed to change an annotation, either because the
 * source is read-only or because the annotation is owned by somebody else.
 */
public class PermissionException extends AnnotationSyncException {

    public PermissionException(String message) {
        super(message);
    }
}
