package com.elime.model;

/**
 * Axis-aligned rectangle in some image space. Two rectangles with identical
 * fields are the same detection candidate.
 */
public record Rectangle(int x, int y, int width, int height) {

    public long area() {
        return (long) width * height;
    }

    /**
     * Middle of the rectangle, truncated to whole pixels.
     */
    public Point center() {
        return new Point(x + width / 2, y + height / 2);
    }

    /**
     * This rectangle, given relative to {@code outer}, expressed in the space
     * {@code outer} lives in.
     */
    public Rectangle relativeTo(Rectangle outer) {
        return new Rectangle(outer.x() + x, outer.y() + y, width, height);
    }
}
