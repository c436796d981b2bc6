package org.neurosync.encoding;

import org.neurosync.annotation.AnnotationIds;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.BackendFamily;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The encoders available for one collection, keyed by geometric type.
 * A collection may not support every type; family A and atlas collections only hold points.
 */
public final class EncoderSet {

    private final BackendFamily family;
    private final Map<AnnotationType, IAnnotationEncoder> encoders;

    EncoderSet(BackendFamily family, Map<AnnotationType, IAnnotationEncoder> encoders) {
        this.family = family;
        this.encoders = Collections.unmodifiableMap(new EnumMap<>(encoders));
    }

    public BackendFamily getFamily() {
        return family;
    }

    public Optional<IAnnotationEncoder> forType(AnnotationType type) {
        return Optional.ofNullable(encoders.get(type));
    }

    /**
     * Classifies the id once and looks up the encoder for its type.
     */
    public Optional<IAnnotationEncoder> forId(String id) {
        return AnnotationIds.typeOf(id).flatMap(this::forType);
    }

    public boolean supports(AnnotationType type) {
        return encoders.containsKey(type);
    }

    public Map<AnnotationType, IAnnotationEncoder> asMap() {
        return encoders;
    }
}
