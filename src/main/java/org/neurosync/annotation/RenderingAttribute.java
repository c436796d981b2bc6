package org.neurosync.annotation;

/**
 * Derives the small integer render hint stored as the first entry of
 * {@link Annotation#getProperties()}.
 * <p>
 * <ul>
 *   <li>{@code Atlas}: -1 when untitled, 1 when checked, otherwise 0</li>
 *   <li>{@code PreSyn}: 4, {@code PostSyn}: 5</li>
 *   <li>{@code Note}: 1 when checked</li>
 *   <li>any other case: 2 for a false split, 3 for a false merge, otherwise 0</li>
 * </ul>
 */
public final class RenderingAttribute {

    public static final int UNTITLED_ATLAS = -1;
    public static final int DEFAULT = 0;
    public static final int CHECKED = 1;
    public static final int FALSE_SPLIT = 2;
    public static final int FALSE_MERGE = 3;
    public static final int PRE_SYNAPSE = 4;
    public static final int POST_SYNAPSE = 5;

    private RenderingAttribute() {
        // Utility class
    }

    public static int of(Annotation annotation) {
        String kind = annotation.getKind();
        if ("Atlas".equals(kind)) {
            String title = annotation.getTitle();
            if (title == null || title.isEmpty()) {
                return UNTITLED_ATLAS;
            }
            return annotation.isChecked() ? CHECKED : DEFAULT;
        }
        if ("PreSyn".equals(kind)) {
            return PRE_SYNAPSE;
        }
        if ("PostSyn".equals(kind)) {
            return POST_SYNAPSE;
        }
        if ("Note".equals(kind) && annotation.isChecked()) {
            return CHECKED;
        }
        return switch (annotation.getBookmarkType()) {
            case FALSE_SPLIT -> FALSE_SPLIT;
            case FALSE_MERGE -> FALSE_MERGE;
            case OTHER -> DEFAULT;
        };
    }
}
