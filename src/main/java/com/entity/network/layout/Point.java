package com.entity.network.layout;

/**
 * A 2D coordinate.
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0.0, 0.0);

    public double distanceTo(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
