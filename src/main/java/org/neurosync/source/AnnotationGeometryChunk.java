package org.neurosync.source;

import org.neurosync.annotation.Annotation;

import java.util.List;

/**
 * Result of one bulk download: the packed geometry for renderers and the decoded annotations.
 *
 * @param data        packed geometry
 * @param annotations decoded annotations in download order
 */
public record AnnotationGeometryChunk(AnnotationGeometryData data, List<Annotation> annotations) {

    public AnnotationGeometryChunk {
        annotations = List.copyOf(annotations);
    }
}
