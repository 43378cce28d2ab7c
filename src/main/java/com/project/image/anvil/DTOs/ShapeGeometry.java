package com.project.image.anvil.DTOs;

/**
 * Anvil placed on a canvas: its bounding box and vertices in canvas pixel coordinates.
 */
public record ShapeGeometry(double left, double top, double width, double height, double[] xs, double[] ys) {

    public double right() {
        return left + width;
    }

    public double bottom() {
        return top + height;
    }

    public double shorterSide() {
        return Math.min(width, height);
    }

    /** Even-odd test of a point against the polygon. */
    public boolean contains(double px, double py) {
        boolean inside = false;
        int n = xs.length;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            if ((ys[i] > py) != (ys[j] > py)) {
                double crossX = xs[j] + (py - ys[j]) * (xs[i] - xs[j]) / (ys[i] - ys[j]);
                if (px < crossX) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    /** Euclidean distance from a point to the nearest polygon edge. */
    public double distanceToBoundary(double px, double py) {
        double best = Double.MAX_VALUE;
        int n = xs.length;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            best = Math.min(best, segmentDistance(px, py, xs[j], ys[j], xs[i], ys[i]));
        }
        return best;
    }

    private static double segmentDistance(double px, double py, double ax, double ay, double bx, double by) {
        double dx = bx - ax;
        double dy = by - ay;
        double lengthSq = dx * dx + dy * dy;
        double t = lengthSq == 0 ? 0 : ((px - ax) * dx + (py - ay) * dy) / lengthSq;
        t = Math.max(0, Math.min(1, t));
        double cx = ax + t * dx - px;
        double cy = ay + t * dy - py;
        return Math.sqrt(cx * cx + cy * cy);
    }
}
