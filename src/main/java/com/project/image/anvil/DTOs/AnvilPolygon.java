package com.project.image.anvil.DTOs;

import java.util.Arrays;
import java.util.List;

/**
 * The anvil outline as a closed path in a normalized 2:1 bounding box. Coordinates are
 * fractions of the box: {@code (0,0)} is its top-left corner, {@code (1,1)} its bottom-right.
 */
public final class AnvilPolygon {

    /** Top-left, top-right, bottom-middle, bottom-left. */
    public static final AnvilPolygon DEFAULT = parse(List.of("0,0", "1,0", "0.5,1", "0,1"));

    private final double[] xs;
    private final double[] ys;

    private AnvilPolygon(double[] xs, double[] ys) {
        this.xs = xs;
        this.ys = ys;
    }

    /**
     * Parses {@code "x,y"} vertex pairs.
     *
     * @throws IllegalArgumentException when fewer than three vertices are given or a
     *                                  coordinate lies outside {@code [0, 1]}
     */
    public static AnvilPolygon parse(List<String> vertices) {
        if (vertices == null || vertices.size() < 3) {
            throw new IllegalArgumentException("Anvil polygon needs at least 3 vertices");
        }
        double[] xs = new double[vertices.size()];
        double[] ys = new double[vertices.size()];
        for (int i = 0; i < vertices.size(); i++) {
            String[] parts = vertices.get(i).split(",");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Vertex must be \"x,y\": " + vertices.get(i));
            }
            xs[i] = parseCoordinate(parts[0], vertices.get(i));
            ys[i] = parseCoordinate(parts[1], vertices.get(i));
        }
        return new AnvilPolygon(xs, ys);
    }

    public int size() {
        return xs.length;
    }

    public double x(int i) {
        return xs[i];
    }

    public double y(int i) {
        return ys[i];
    }

    private static double parseCoordinate(String raw, String vertex) {
        double v;
        try {
            v = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid vertex: " + vertex, e);
        }
        if (!(v >= 0.0 && v <= 1.0)) {
            throw new IllegalArgumentException("Vertex coordinate outside [0, 1]: " + vertex);
        }
        return v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnvilPolygon other)) return false;
        return Arrays.equals(xs, other.xs) && Arrays.equals(ys, other.ys);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(xs) + Arrays.hashCode(ys);
    }
}
