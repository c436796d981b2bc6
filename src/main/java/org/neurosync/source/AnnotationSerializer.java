package org.neurosync.source;

import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.Vec3;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates decoded annotations and packs them into {@link AnnotationGeometryData}.
 * Not thread-safe; one instance per chunk.
 */
public class AnnotationSerializer {

    private static final int FLOAT_BYTES = Float.BYTES;

    private final List<AnnotationPropertySpec> propertySpecs;
    private final Map<AnnotationType, List<Annotation>> annotations = new EnumMap<>(AnnotationType.class);

    public AnnotationSerializer(List<AnnotationPropertySpec> propertySpecs) {
        this.propertySpecs = List.copyOf(propertySpecs);
        for (AnnotationType type : AnnotationType.values()) {
            annotations.put(type, new ArrayList<>());
        }
    }

    public void add(Annotation annotation) {
        annotations.get(annotation.getType()).add(annotation);
    }

    public int recordSize(AnnotationType type) {
        return (type.getPointCount() * 3 + propertySpecs.size()) * FLOAT_BYTES;
    }

    public AnnotationGeometryData serialize() {
        int total = 0;
        int[] typeToOffset = new int[AnnotationType.values().length];
        for (AnnotationType type : AnnotationType.values()) {
            typeToOffset[type.ordinal()] = total;
            total += annotations.get(type).size() * recordSize(type);
        }

        ByteBuffer buffer = ByteBuffer.allocate(total).order(ByteOrder.LITTLE_ENDIAN);
        Map<AnnotationType, List<String>> typeToIds = new EnumMap<>(AnnotationType.class);
        for (AnnotationType type : AnnotationType.values()) {
            List<String> ids = new ArrayList<>();
            for (Annotation annotation : annotations.get(type)) {
                writePoint(buffer, annotation.getPointA());
                if (type.getPointCount() > 1) {
                    writePoint(buffer, annotation.getPointB());
                }
                writeProperties(buffer, annotation.getProperties());
                ids.add(annotation.getId());
            }
            typeToIds.put(type, Collections.unmodifiableList(ids));
        }
        return new AnnotationGeometryData(buffer.array(), typeToOffset, Collections.unmodifiableMap(typeToIds));
    }

    private static void writePoint(ByteBuffer buffer, Vec3 point) {
        buffer.putFloat((float) point.x());
        buffer.putFloat((float) point.y());
        buffer.putFloat((float) point.z());
    }

    private void writeProperties(ByteBuffer buffer, List<Number> values) {
        for (int i = 0; i < propertySpecs.size(); i++) {
            AnnotationPropertySpec spec = propertySpecs.get(i);
            double value = i < values.size() && values.get(i) != null ? values.get(i).doubleValue() : spec.defaultValue();
            switch (spec.type()) {
                case INT32 -> buffer.putInt((int) value);
                case FLOAT32 -> buffer.putFloat((float) value);
            }
        }
    }
}
