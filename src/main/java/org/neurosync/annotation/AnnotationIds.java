package org.neurosync.annotation;

import org.neurosync.api.AnnotationValidationException;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identity and type codec for annotation ids.
 * <p>
 * Keys are derived from rounded integer coordinates:
 * <pre>
 *   family A: 10_20_30            10_20_30-40_50_60-Line       10_20_30-40_50_60-Sphere
 *   family B: Pt10_20_30          Ln10_20_30_40_50_60          Sp10_20_30_40_50_60
 * </pre>
 * A family B id appends the author to the key, e.g. {@code Pt10_20_30[user:alice]}, so that
 * two users annotating the same voxel do not collide. A family A id is the key itself.
 */
public final class AnnotationIds {

    private static final String N = "-?\\d+";
    private static final String USER_SUFFIX = "(\\[user:.*])?";

    private static final Pattern POINT = Pattern.compile(
        "^(?:Pt)?" + N + "_" + N + "_" + N + USER_SUFFIX + "$");
    private static final Pattern LINE = Pattern.compile(
        "^(?:" + N + "_" + N + "_" + N + "-" + N + "_" + N + "_" + N + "-Line"
            + "|Ln" + N + "_" + N + "_" + N + "_" + N + "_" + N + "_" + N + ")" + USER_SUFFIX + "$");
    private static final Pattern SPHERE = Pattern.compile(
        "^(?:" + N + "_" + N + "_" + N + "-" + N + "_" + N + "_" + N + "-Sphere"
            + "|Sp" + N + "_" + N + "_" + N + "_" + N + "_" + N + "_" + N + ")" + USER_SUFFIX + "$");

    private static final Pattern USER_ID = Pattern.compile("(.*)\\[user:(.*)]");
    private static final Pattern POSITION = Pattern.compile("(" + N + ")_(" + N + ")_(" + N + ")");

    private AnnotationIds() {
        // Utility class
    }

    /**
     * Classifies an id or key by its structural pattern.
     *
     * @param id the id or key to classify
     * @return the geometric type, or empty if the id is not recognized
     */
    public static Optional<AnnotationType> typeOf(String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        if (LINE.matcher(id).matches()) {
            return Optional.of(AnnotationType.LINE);
        }
        if (SPHERE.matcher(id).matches()) {
            return Optional.of(AnnotationType.SPHERE);
        }
        if (POINT.matcher(id).matches()) {
            return Optional.of(AnnotationType.POINT);
        }
        return Optional.empty();
    }

    /**
     * Like {@link #typeOf(String)} but fails for unrecognized ids.
     *
     * @throws AnnotationValidationException if the id is not recognized
     */
    public static AnnotationType requireType(String id) {
        return typeOf(id).orElseThrow(
            () -> new AnnotationValidationException("Invalid annotation ID: " + id));
    }

    public static boolean isValid(String id) {
        return typeOf(id).isPresent();
    }

    /**
     * Derives the key of an annotation. An explicit key from a previous server round-trip
     * takes precedence over derivation.
     */
    public static String deriveKey(Annotation annotation, BackendFamily family) {
        if (annotation.getKey() != null && !annotation.getKey().isEmpty()) {
            return annotation.getKey();
        }
        return geometricKey(annotation, family);
    }

    /**
     * Derives the id of an annotation using its own key.
     */
    public static String deriveId(Annotation annotation, BackendFamily family) {
        return deriveId(annotation, family, null);
    }

    /**
     * Derives the id of an annotation.
     *
     * @param keyOverride key acknowledged by the server, used instead of the annotation's own
     *                    key when not {@code null}
     */
    public static String deriveId(Annotation annotation, BackendFamily family, String keyOverride) {
        String key = (keyOverride != null && !keyOverride.isEmpty()) ? keyOverride : deriveKey(annotation, family);
        if (family == BackendFamily.A) {
            return key;
        }
        String user = annotation.getUser();
        return key + "[user:" + (user == null ? "" : user) + "]";
    }

    /**
     * Splits a family B id into key and user.
     *
     * @return the parts, or empty if the id carries no user suffix
     */
    public static Optional<ParsedId> parseId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Matcher matcher = USER_ID.matcher(id);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedId(matcher.group(1), matcher.group(2)));
    }

    /**
     * @return the key part of an id, or the id itself if it carries no user suffix
     */
    public static String keyOf(String id) {
        return parseId(id).map(ParsedId::key).orElse(id);
    }

    /**
     * Extracts the first {@code x_y_z} triple embedded in a key.
     */
    public static Optional<long[]> positionOf(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Matcher matcher = POSITION.matcher(key);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new long[] {
            Long.parseLong(matcher.group(1)),
            Long.parseLong(matcher.group(2)),
            Long.parseLong(matcher.group(3))
        });
    }

    private static String geometricKey(Annotation annotation, BackendFamily family) {
        Vec3 a = annotation.getPointA();
        Vec3 b = annotation.getPointB();
        if (family == BackendFamily.A) {
            return switch (annotation.getType()) {
                case POINT -> a.toKeyString();
                case LINE -> a.toKeyString() + "-" + b.toKeyString() + "-Line";
                case SPHERE -> a.toKeyString() + "-" + b.toKeyString() + "-Sphere";
            };
        }
        return switch (annotation.getType()) {
            case POINT -> "Pt" + a.toKeyString();
            case LINE -> "Ln" + a.toKeyString() + "_" + b.toKeyString();
            case SPHERE -> "Sp" + a.toKeyString() + "_" + b.toKeyString();
        };
    }

    /**
     * Key and author of a family B id.
     *
     * @param key  the geometric or server-assigned key
     * @param user the author
     */
    public record ParsedId(String key, String user) {
    }
}
