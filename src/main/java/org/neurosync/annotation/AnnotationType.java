package org.neurosync.annotation;

/**
 * Geometric discriminant of an annotation.
 */
public enum AnnotationType {
    POINT(1),
    LINE(2),
    SPHERE(2);

    private final int pointCount;

    AnnotationType(int pointCount) {
        this.pointCount = pointCount;
    }

    /**
     * @return number of 3-vectors that make up the geometry (1 for points, 2 otherwise)
     */
    public int getPointCount() {
        return pointCount;
    }

    /**
     * @return number of coordinates that make up the geometry
     */
    public int getCoordinateCount() {
        return pointCount * 3;
    }
}
