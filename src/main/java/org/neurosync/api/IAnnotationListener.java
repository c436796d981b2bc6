package org.neurosync.api;

import org.neurosync.annotation.Annotation;

/**
 * Observer of changes to a remote annotation collection.
 * <p>
 * Implemented by whatever owns the in-memory view of the collection. Callbacks may arrive on
 * HTTP client threads; implementations must be thread-safe.
 */
public interface IAnnotationListener {

    /**
     * Called for each annotation discovered by a bulk download that requested add signals.
     *
     * @param annotation the fully decoded annotation
     */
    void childAdded(Annotation annotation);

    /**
     * Called after an update was accepted.
     *
     * @param annotation the annotation as it was written
     */
    default void childUpdated(Annotation annotation) {
    }

    /**
     * Called after a delete was confirmed.
     *
     * @param annotationId id of the removed annotation
     */
    default void childDeleted(String annotationId) {
    }
}
