package org.neurosync.source;

import org.neurosync.annotation.AnnotationType;

import java.util.List;
import java.util.Map;

/**
 * Packed binary form of a chunk, grouped by geometric type.
 * <p>
 * For each type, in {@link AnnotationType} order, the records of that type start at
 * {@code typeToOffset[type.ordinal()]}. A record is the float32 coordinates of the type's
 * points followed by one 4-byte value per {@link AnnotationPropertySpec}, all little-endian.
 *
 * @param data         the packed records
 * @param typeToOffset byte offset of the first record of each type
 * @param typeToIds    annotation ids in record order, per type
 */
public record AnnotationGeometryData(byte[] data, int[] typeToOffset, Map<AnnotationType, List<String>> typeToIds) {

    public int count(AnnotationType type) {
        List<String> ids = typeToIds.get(type);
        return ids == null ? 0 : ids.size();
    }
}
