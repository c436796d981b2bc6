package org.neurosync.annotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A point, line segment or sphere placed on volumetric imagery, together with its metadata.
 * <p>
 * Instances are immutable. All {@code with*} methods return a new instance whose derived
 * fields ({@link #getDescription() description} and {@link #getProperties() properties}) are
 * recomputed from {@code prop}, {@code ext} and {@code kind}. The only way to set the
 * description independently is {@link Builder#description(String)}, which is used for the raw
 * free text typed by a user before it is folded into {@code prop.comment}.
 * <p>
 * For points only {@link #getPointA()} is set. Lines and spheres use both endpoints; for a
 * sphere the pair defines center and radius.
 */
public final class Annotation {

    public static final String PROP_TITLE = "title";
    public static final String PROP_COMMENT = "comment";
    public static final String PROP_USER = "user";
    public static final String PROP_TIMESTAMP = "timestamp";
    public static final String PROP_CHECKED = "checked";
    public static final String PROP_TYPE = "type";

    public static final String EXT_USER = "user";
    public static final String EXT_VERIFIED = "verified";

    private final AnnotationType type;
    private final Vec3 pointA;
    private final Vec3 pointB;
    private final String id;
    private final String key;
    private final String kind;
    private final String description;
    private final List<Number> properties;
    private final Map<String, Object> prop;
    private final Map<String, Object> ext;
    private final List<List<Long>> relatedSegments;
    private final String source;

    private Annotation(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.pointA = Objects.requireNonNull(builder.pointA, "pointA");
        if (type != AnnotationType.POINT) {
            Objects.requireNonNull(builder.pointB, "pointB is required for " + type);
            this.pointB = builder.pointB;
        } else {
            this.pointB = null;
        }
        this.id = builder.id;
        this.key = builder.key;
        this.kind = builder.kind;
        this.description = builder.description;
        this.properties = List.copyOf(builder.properties);
        this.prop = Collections.unmodifiableMap(new LinkedHashMap<>(builder.prop));
        this.ext = Collections.unmodifiableMap(new LinkedHashMap<>(builder.ext));
        List<List<Long>> segments = new ArrayList<>();
        for (List<Long> group : builder.relatedSegments) {
            segments.add(List.copyOf(group));
        }
        this.relatedSegments = Collections.unmodifiableList(segments);
        this.source = builder.source;
    }

    public static Builder point(Vec3 position) {
        return new Builder(AnnotationType.POINT).pointA(position);
    }

    public static Builder line(Vec3 pointA, Vec3 pointB) {
        return new Builder(AnnotationType.LINE).pointA(pointA).pointB(pointB);
    }

    public static Builder sphere(Vec3 pointA, Vec3 pointB) {
        return new Builder(AnnotationType.SPHERE).pointA(pointA).pointB(pointB);
    }

    public static Builder builder(AnnotationType type) {
        return new Builder(type);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(type)
            .pointA(pointA)
            .pointB(pointB)
            .id(id)
            .key(key)
            .kind(kind)
            .description(description)
            .properties(properties)
            .prop(prop)
            .ext(ext)
            .source(source);
        builder.relatedSegments.addAll(relatedSegments);
        return builder;
    }

    public AnnotationType getType() {
        return type;
    }

    /**
     * @return the position of a point, or the first endpoint of a line or sphere
     */
    public Vec3 getPointA() {
        return pointA;
    }

    /**
     * @return the second endpoint of a line or sphere, {@code null} for points
     */
    public Vec3 getPointB() {
        return pointB;
    }

    public String getId() {
        return id;
    }

    /**
     * @return the key assigned by a previous server round-trip, or {@code null}
     */
    public String getKey() {
        return key;
    }

    public String getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    public List<Number> getProperties() {
        return properties;
    }

    public Map<String, Object> getProp() {
        return prop;
    }

    public Map<String, Object> getExt() {
        return ext;
    }

    public List<List<Long>> getRelatedSegments() {
        return relatedSegments;
    }

    public String getSource() {
        return source;
    }

    public String getTitle() {
        return stringValue(prop.get(PROP_TITLE));
    }

    public String getComment() {
        return stringValue(prop.get(PROP_COMMENT));
    }

    /**
     * @return the author, preferring the value echoed by the server in {@code ext}
     */
    public String getUser() {
        String extUser = stringValue(ext.get(EXT_USER));
        if (extUser != null && !extUser.isEmpty()) {
            return extUser;
        }
        return stringValue(prop.get(PROP_USER));
    }

    /**
     * @return whether the annotation was verified on the server or checked locally
     */
    public boolean isChecked() {
        return isTrue(ext.get(EXT_VERIFIED)) || isTrue(prop.get(PROP_CHECKED));
    }

    /**
     * @return creation time in epoch milliseconds, 0 when unknown
     */
    public long getTimestamp() {
        Object value = prop.get(PROP_TIMESTAMP);
        if (value == null) {
            return 0L;
        }
        try {
            return value instanceof Number number ? number.longValue() : Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /**
     * Classifies the free-text {@code prop.type} tag: a reported split is a false merge and
     * a reported merge is a false split.
     */
    public BookmarkType getBookmarkType() {
        Object value = prop.get(PROP_TYPE);
        if ("Split".equals(value)) {
            return BookmarkType.FALSE_MERGE;
        }
        if ("Merge".equals(value)) {
            return BookmarkType.FALSE_SPLIT;
        }
        return BookmarkType.OTHER;
    }

    /**
     * @return {@code title + ": " + comment} when a title is present, otherwise the comment
     */
    public String getPresentation() {
        String title = getTitle();
        String comment = getComment();
        StringBuilder sb = new StringBuilder();
        if (title != null && !title.isEmpty()) {
            sb.append(title).append(": ");
        }
        if (comment != null) {
            sb.append(comment);
        }
        return sb.toString();
    }

    public Annotation withTitle(String title) {
        return withPropEntry(PROP_TITLE, title);
    }

    public Annotation withComment(String comment) {
        return withPropEntry(PROP_COMMENT, comment);
    }

    public Annotation withUser(String user) {
        return withPropEntry(PROP_USER, user);
    }

    public Annotation withChecked(boolean checked) {
        return withPropEntry(PROP_CHECKED, checked);
    }

    public Annotation withTimestamp(long epochMillis) {
        return withPropEntry(PROP_TIMESTAMP, String.valueOf(epochMillis));
    }

    public Annotation withKind(String kind) {
        return toBuilder().kind(kind).build().recomputed();
    }

    /**
     * Shallow-merges {@code values} into {@code prop}.
     */
    public Annotation withProp(Map<String, ?> values) {
        Builder builder = toBuilder();
        builder.prop.putAll(values);
        return builder.build().recomputed();
    }

    public Annotation withId(String id) {
        return toBuilder().id(id).build();
    }

    public Annotation withKey(String key) {
        return toBuilder().key(key).build();
    }

    public Annotation withSource(String source) {
        return toBuilder().source(source).build();
    }

    /**
     * @return a copy whose coordinates are rounded to integers
     */
    public Annotation rounded() {
        Builder builder = toBuilder().pointA(pointA.rounded());
        if (pointB != null) {
            builder.pointB(pointB.rounded());
        }
        return builder.build();
    }

    /**
     * @return a copy with {@code description} and {@code properties} derived from the
     *         current metadata
     */
    public Annotation recomputed() {
        Builder builder = toBuilder();
        builder.description(getPresentation());
        builder.properties(List.of(RenderingAttribute.of(this)));
        return builder.build();
    }

    private Annotation withPropEntry(String name, Object value) {
        Builder builder = toBuilder();
        if (value == null) {
            builder.prop.remove(name);
        } else {
            builder.prop.put(name, value);
        }
        return builder.build().recomputed();
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && "true".equalsIgnoreCase(value.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Annotation that)) {
            return false;
        }
        return type == that.type
            && pointA.equals(that.pointA)
            && Objects.equals(pointB, that.pointB)
            && Objects.equals(id, that.id)
            && Objects.equals(key, that.key)
            && Objects.equals(kind, that.kind)
            && Objects.equals(description, that.description)
            && properties.equals(that.properties)
            && prop.equals(that.prop)
            && ext.equals(that.ext)
            && relatedSegments.equals(that.relatedSegments)
            && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, pointA, pointB, id, key, kind, prop, ext);
    }

    @Override
    public String toString() {
        return "Annotation{" +
            "type=" + type +
            ", id='" + id + '\'' +
            ", kind='" + kind + '\'' +
            ", pointA=" + pointA +
            (pointB != null ? ", pointB=" + pointB : "") +
            ", description='" + description + '\'' +
            '}';
    }

    /**
     * Builder for {@link Annotation}. Derived fields are taken as given; call
     * {@link Annotation#recomputed()} on the result to derive them.
     */
    public static final class Builder {
        private final AnnotationType type;
        private Vec3 pointA;
        private Vec3 pointB;
        private String id;
        private String key;
        private String kind;
        private String description;
        private List<Number> properties = List.of();
        private final Map<String, Object> prop = new LinkedHashMap<>();
        private final Map<String, Object> ext = new LinkedHashMap<>();
        private final List<List<Long>> relatedSegments = new ArrayList<>();
        private String source;

        private Builder(AnnotationType type) {
            this.type = type;
        }

        public Builder pointA(Vec3 pointA) {
            this.pointA = pointA;
            return this;
        }

        public Builder pointB(Vec3 pointB) {
            this.pointB = pointB;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder properties(List<? extends Number> properties) {
            this.properties = List.copyOf(properties);
            return this;
        }

        public Builder prop(Map<String, ?> prop) {
            this.prop.clear();
            this.prop.putAll(prop);
            return this;
        }

        public Builder putProp(String name, Object value) {
            this.prop.put(name, value);
            return this;
        }

        public Builder ext(Map<String, ?> ext) {
            this.ext.clear();
            this.ext.putAll(ext);
            return this;
        }

        public Builder putExt(String name, Object value) {
            this.ext.put(name, value);
            return this;
        }

        public Builder addRelatedSegments(List<Long> segments) {
            this.relatedSegments.add(segments);
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Annotation build() {
            return new Annotation(this);
        }
    }
}
