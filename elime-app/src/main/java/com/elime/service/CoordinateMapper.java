package com.elime.service;

import com.elime.model.Point;

/**
 * Maps points between a native image and its downscaled working copy.
 *
 * Both directions truncate toward zero, so a native point sent to working
 * space and back can land a pixel or two up and to the left of where it
 * started. It never overshoots.
 */
public final class CoordinateMapper {

    private final double scale;

    public CoordinateMapper(double scale) {
        if (scale < 1.0) {
            throw new IllegalArgumentException("Scale must be at least 1.0, got " + scale);
        }
        this.scale = scale;
    }

    /**
     * Mapper for an image of the given size that must fit into
     * {@code maxDimension} on its longer side.
     */
    public static CoordinateMapper forImage(int width, int height, int maxDimension) {
        double max = maxDimension;
        double scale = 1.0;
        if (width > max || height > max) {
            scale = Math.max(width / max, height / max);
        }
        return new CoordinateMapper(scale);
    }

    public double scale() {
        return scale;
    }

    public int workingLength(int nativeLength) {
        return (int) (nativeLength / scale);
    }

    public Point toWorking(Point nativePoint) {
        return new Point((int) (nativePoint.x() / scale), (int) (nativePoint.y() / scale));
    }

    public Point toNative(Point workingPoint) {
        return new Point((int) (workingPoint.x() * scale), (int) (workingPoint.y() * scale));
    }
}
