package org.neurosync.encoding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.AnnotationIds;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.BackendFamily;
import org.neurosync.annotation.DescriptionSentinel;
import org.neurosync.annotation.Vec3;
import org.neurosync.api.AnnotationValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared envelope of the family B (v2/v3) schema:
 * <pre>
 * { "kind": "point" | "lineseg" | "sphere", "pos": [x, y, z(, x2, y2, z2)],
 *   "tags": [], "verified": false, "description": "...", "title": "...", "user": "...",
 *   "prop": { ... } }
 * </pre>
 * A description of the form {@code ${<json>:JSON}} is merged into {@code prop} instead of
 * being kept as a comment.
 */
public abstract class AbstractV2AnnotationEncoder extends AbstractAnnotationEncoder {

    static final String FIELD_KIND = "kind";
    static final String FIELD_POS = "pos";
    static final String FIELD_TAGS = "tags";
    static final String FIELD_VERIFIED = "verified";
    static final String FIELD_PROP = "prop";

    private final String wireKind;
    private final DescriptionSentinel sentinel;

    protected AbstractV2AnnotationEncoder(ObjectMapper mapper, AnnotationType type, String wireKind,
                                          boolean sendingToServer) {
        super(mapper, BackendFamily.B, type, sendingToServer);
        this.wireKind = wireKind;
        this.sentinel = new DescriptionSentinel(mapper);
    }

    /**
     * @return the {@code kind} tag this encoder writes and accepts
     */
    public String getWireKind() {
        return wireKind;
    }

    /**
     * @return the annotation kind assigned to decoded entries, may be {@code null}
     */
    protected abstract String getDefaultKind();

    @Override
    public Optional<ObjectNode> encode(Annotation annotation) {
        String user = annotation.getUser();
        if (!hasText(user)) {
            return Optional.empty();
        }

        ObjectNode obj = mapper.createObjectNode();
        obj.set(FIELD_TAGS, encodeTags(annotation));
        if (annotation.getComment() != null) {
            obj.put("description", annotation.getComment());
        }
        obj.put("user", user);
        obj.put(FIELD_VERIFIED, annotation.isChecked());
        if (annotation.getTitle() != null) {
            obj.put("title", annotation.getTitle());
        }

        Map<String, Object> prop = new LinkedHashMap<>(annotation.getProp());
        prop.remove(Annotation.PROP_TITLE);
        prop.remove(Annotation.PROP_COMMENT);
        prop.remove(Annotation.PROP_USER);
        prop.remove(Annotation.PROP_CHECKED);
        obj.set(FIELD_PROP, mapper.valueToTree(prop));

        obj.put(FIELD_KIND, wireKind);
        ArrayNode pos = obj.putArray(FIELD_POS);
        for (long value : annotation.getPointA().toLongs()) {
            pos.add(value);
        }
        if (getType() != AnnotationType.POINT) {
            for (long value : annotation.getPointB().toLongs()) {
                pos.add(value);
            }
        }
        return Optional.of(obj);
    }

    @Override
    protected Annotation decodeEntry(String key, ObjectNode entry) {
        String tag = requireString(entry, FIELD_KIND);
        if (!wireKind.equals(tag)) {
            throw new AnnotationValidationException(
                "Invalid kind for " + getType().name().toLowerCase() + " annotation data: " + tag);
        }
        long[] pos = requireIntVector(entry, FIELD_POS, getType().getCoordinateCount());

        Vec3 pointA = new Vec3(pos[0], pos[1], pos[2]);
        Annotation.Builder builder = Annotation.builder(getType())
            .pointA(pointA)
            .key(key)
            .kind(getDefaultKind())
            .prop(optionalObject(entry, FIELD_PROP));
        if (getType() != AnnotationType.POINT) {
            builder.pointB(new Vec3(pos[3], pos[4], pos[5]));
        }

        String description = optionalString(entry, "description");
        Optional<Map<String, Object>> structured = sentinel.parse(description);
        if (structured.isPresent()) {
            structured.get().forEach(builder::putProp);
        } else if (hasText(description)) {
            builder.putProp(Annotation.PROP_COMMENT, description);
        }

        String title = optionalString(entry, "title");
        if (hasText(title)) {
            builder.putProp(Annotation.PROP_TITLE, title);
        }
        String user = optionalString(entry, "user");
        if (hasText(user)) {
            builder.putProp(Annotation.PROP_USER, user);
            builder.putExt(Annotation.EXT_USER, user);
        }
        Boolean verified = optionalBoolean(entry, FIELD_VERIFIED);
        if (verified != null) {
            builder.putExt(Annotation.EXT_VERIFIED, verified);
        }
        JsonNode tags = entry.get(FIELD_TAGS);
        if (tags != null && tags.isArray() && !tags.isEmpty()) {
            List<String> values = new ArrayList<>();
            tags.forEach(t -> values.add(t.asText()));
            builder.putExt(FIELD_TAGS, values);
        }

        Annotation annotation = builder.build();
        return annotation.withId(AnnotationIds.deriveId(annotation, BackendFamily.B)).recomputed();
    }

    @Override
    public ObjectNode withDefaultDiscriminant(ObjectNode entry, String contextKind) {
        ObjectNode copy = entry.deepCopy();
        if (!copy.has(FIELD_KIND)) {
            copy.put(FIELD_KIND, wireKind);
        }
        return copy;
    }

    private ArrayNode encodeTags(Annotation annotation) {
        ArrayNode tags = mapper.createArrayNode();
        Object existing = annotation.getExt().get(FIELD_TAGS);
        if (existing instanceof List<?> list) {
            list.forEach(t -> tags.add(String.valueOf(t)));
        }
        return tags;
    }
}
