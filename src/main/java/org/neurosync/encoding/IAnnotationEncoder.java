package org.neurosync.encoding;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.BackendFamily;

import java.util.Optional;

/**
 * Strategy converting between {@link Annotation} and the raw JSON entry of one backend
 * family, for one geometric type.
 * <p>
 * Implementations are stateless and thread-safe.
 *
 * @see AnnotationEncoderFactory
 */
public interface IAnnotationEncoder {

    /**
     * @return the family whose wire format this encoder speaks
     */
    BackendFamily getFamily();

    /**
     * @return the geometric type handled by this encoder
     */
    AnnotationType getType();

    /**
     * Converts an annotation into a backend entry.
     *
     * @param annotation the annotation to encode, with rounded coordinates
     * @return the entry, or empty when a precondition for uploading is missing (for example
     *         no author); the caller treats this as "do not upload"
     */
    Optional<ObjectNode> encode(Annotation annotation);

    /**
     * Converts a backend entry into an annotation.
     * <p>
     * Never throws for malformed input: schema mismatches are logged and reported as empty.
     *
     * @param key   the key under which the entry is stored
     * @param entry the raw entry
     * @return the decoded annotation, or empty on any schema mismatch
     */
    Optional<Annotation> decode(String key, ObjectNode entry);

    /**
     * Upload policy for an annotation, independent of whether it encodes.
     */
    boolean uploadable(Annotation annotation);

    /**
     * Upload policy when only the id is known (no cached entry to decode).
     */
    boolean uploadableById(String id);

    /**
     * Returns a copy of {@code entry} carrying the discriminant this encoder dispatches on,
     * synthesizing it from the context when the entry lacks one.
     *
     * @param entry       the raw entry, not modified
     * @param contextKind the kind configured for the containing collection, may be {@code null}
     * @return the entry to decode
     */
    ObjectNode withDefaultDiscriminant(ObjectNode entry, String contextKind);
}
