package org.neurosync.source;

import com.typesafe.config.Config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A numeric per-annotation property written by {@link AnnotationSerializer}.
 *
 * @param identifier   property name, e.g. {@code rendering_attribute}
 * @param type         storage type
 * @param defaultValue value written when an annotation does not carry the property
 */
public record AnnotationPropertySpec(String identifier, PropertyType type, double defaultValue) {

    public static final AnnotationPropertySpec RENDERING_ATTRIBUTE =
        new AnnotationPropertySpec("rendering_attribute", PropertyType.INT32, 0);

    public enum PropertyType {
        INT32,
        FLOAT32
    }

    /**
     * Reads a list of specs, each an object with {@code identifier}, {@code type}
     * ({@code int32} or {@code float32}) and an optional {@code default}.
     */
    public static List<AnnotationPropertySpec> fromConfig(List<? extends Config> configs) {
        List<AnnotationPropertySpec> specs = new ArrayList<>();
        for (Config config : configs) {
            PropertyType type = PropertyType.valueOf(config.getString("type").toUpperCase(Locale.ROOT));
            double defaultValue = config.hasPath("default") ? config.getDouble("default") : 0;
            specs.add(new AnnotationPropertySpec(config.getString("identifier"), type, defaultValue));
        }
        return List.copyOf(specs);
    }
}
