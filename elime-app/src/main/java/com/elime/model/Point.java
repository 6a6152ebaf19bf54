package com.elime.model;

/**
 * Integer pixel coordinate. Whether it lives in native or working image space
 * depends on who holds it.
 */
public record Point(int x, int y) {

    public Point translate(int dx, int dy) {
        return new Point(x + dx, y + dy);
    }
}
