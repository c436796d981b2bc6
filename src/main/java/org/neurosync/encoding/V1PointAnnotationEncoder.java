package org.neurosync.encoding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.BackendFamily;
import org.neurosync.annotation.Vec3;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Family A point encoder for the flat v1 schema:
 * <pre>
 * { "Kind": "Note", "description": "title: comment", "title": "...", "user": "...", "Prop": { ... } }
 * </pre>
 * The position is not part of the payload; it is recovered from the {@code x_y_z} key, or
 * from a {@code location} / {@code Pos} field for entries stored under other keys.
 */
public class V1PointAnnotationEncoder extends AbstractAnnotationEncoder {

    static final String FIELD_KIND = "Kind";
    static final String FIELD_PROP = "Prop";
    static final String FIELD_POS = "Pos";
    static final String FIELD_LOCATION = "location";
    static final String BODY_ID = "body ID";

    private static final Pattern KEY_POSITION = Pattern.compile("^(-?\\d+)_(-?\\d+)_(-?\\d+)$");

    public V1PointAnnotationEncoder(ObjectMapper mapper, boolean sendingToServer) {
        super(mapper, BackendFamily.A, AnnotationType.POINT, sendingToServer);
    }

    @Override
    public Optional<ObjectNode> encode(Annotation annotation) {
        ObjectNode obj = mapper.createObjectNode();
        if (annotation.getKind() != null) {
            obj.put(FIELD_KIND, annotation.getKind());
        }
        obj.put("description", annotation.getPresentation());
        if (annotation.getTitle() != null) {
            obj.put("title", annotation.getTitle());
        }
        if (annotation.getUser() != null) {
            obj.put("user", annotation.getUser());
        }

        // title, comment and user already travel as top-level fields
        Map<String, Object> prop = new LinkedHashMap<>(annotation.getProp());
        prop.remove(Annotation.PROP_COMMENT);
        prop.remove(Annotation.PROP_USER);
        prop.remove(Annotation.PROP_TITLE);
        obj.set(FIELD_PROP, mapper.valueToTree(prop));

        return Optional.of(obj);
    }

    @Override
    protected Annotation decodeEntry(String key, ObjectNode entry) {
        String kind = requireString(entry, FIELD_KIND);
        long[] position = positionFromKey(key);
        if (position == null) {
            String posField = entry.has(FIELD_LOCATION) ? FIELD_LOCATION : FIELD_POS;
            position = requireIntVector(entry, posField, 3);
        }
        Map<String, Object> prop = optionalObject(entry, FIELD_PROP);
        String description = optionalString(entry, "description");
        String title = optionalString(entry, "title");
        String user = optionalString(entry, "user");

        Vec3 point = new Vec3(position[0], position[1], position[2]);
        Annotation.Builder builder = Annotation.point(point)
            .kind(kind)
            .id(point.toKeyString())
            .prop(prop);
        if (hasText(title)) {
            builder.putProp(Annotation.PROP_TITLE, title);
        }
        if (hasText(user)) {
            builder.putProp(Annotation.PROP_USER, user);
        }
        String comment = stripTitle(description, title);
        if (hasText(comment)) {
            builder.putProp(Annotation.PROP_COMMENT, comment);
        }
        if ("Note".equals(kind) && prop.get(BODY_ID) != null) {
            String bodyId = prop.get(BODY_ID).toString().trim();
            if (!bodyId.isEmpty()) {
                builder.addRelatedSegments(List.of(Long.parseUnsignedLong(bodyId)));
            }
        }
        return builder.build().recomputed();
    }

    @Override
    public ObjectNode withDefaultDiscriminant(ObjectNode entry, String contextKind) {
        ObjectNode copy = entry.deepCopy();
        if (!copy.has(FIELD_KIND) && contextKind != null) {
            copy.put(FIELD_KIND, contextKind);
        }
        return copy;
    }

    private static long[] positionFromKey(String key) {
        if (key == null) {
            return null;
        }
        Matcher matcher = KEY_POSITION.matcher(key);
        if (!matcher.matches()) {
            return null;
        }
        return new long[] {
            Long.parseLong(matcher.group(1)),
            Long.parseLong(matcher.group(2)),
            Long.parseLong(matcher.group(3))
        };
    }

    /**
     * The v1 description holds the presentation {@code title: comment}; recover the comment.
     */
    private static String stripTitle(String description, String title) {
        if (description == null) {
            return null;
        }
        if (hasText(title) && description.startsWith(title + ": ")) {
            return description.substring(title.length() + 2);
        }
        return description;
    }
}
