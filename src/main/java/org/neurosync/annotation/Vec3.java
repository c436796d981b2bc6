package org.neurosync.annotation;

import java.util.List;

/**
 * Immutable 3-vector in voxel coordinates.
 *
 * @param x x coordinate
 * @param y y coordinate
 * @param z z coordinate
 */
public record Vec3(double x, double y, double z) {

    public static Vec3 of(double x, double y, double z) {
        return new Vec3(x, y, z);
    }

    /**
     * @return a copy with each coordinate rounded to the nearest integer
     */
    public Vec3 rounded() {
        return new Vec3(Math.round(x), Math.round(y), Math.round(z));
    }

    /**
     * @return the rounded integer coordinates, in x, y, z order
     */
    public long[] toLongs() {
        return new long[] {Math.round(x), Math.round(y), Math.round(z)};
    }

    public List<Double> toList() {
        return List.of(x, y, z);
    }

    /**
     * Formats the rounded coordinates joined by underscores, e.g. {@code 10_20_-3}.
     */
    public String toKeyString() {
        return Math.round(x) + "_" + Math.round(y) + "_" + Math.round(z);
    }
}
