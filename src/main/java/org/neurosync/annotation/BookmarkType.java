package org.neurosync.annotation;

/**
 * Classification of explanatory bookmark tags attached to an annotation.
 */
public enum BookmarkType {
    FALSE_SPLIT("False Split"),
    FALSE_MERGE("False Merge"),
    OTHER("Other");

    private final String label;

    BookmarkType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
