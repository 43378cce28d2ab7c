package com.project.image.anvil.DTOs;

import com.project.image.anvil.exceptions.SpecValidationException;

/**
 * User-chosen anvil parameters. Immutable, validated on construction.
 *
 * @param scale       shape width as a fraction of the limiting canvas dimension, [0.5, 1.0]
 * @param offsetX     horizontal position as a fraction of the remaining slack, [-1, 1]
 * @param offsetY     vertical position as a fraction of the remaining slack, [-1, 1]
 * @param color       fill / stroke colour
 * @param opacity     fill opacity used by the Flat style, [0, 1]
 * @param aspectRatio crop ratio of the canvas
 */
public record AnvilSpec(
        double scale,
        double offsetX,
        double offsetY,
        RgbColor color,
        double opacity,
        AspectRatio aspectRatio
) {
    public static final double MIN_SCALE = 0.5;
    public static final double MAX_SCALE = 1.0;

    public AnvilSpec {
        requireRange("scale", scale, MIN_SCALE, MAX_SCALE);
        requireRange("offsetX", offsetX, -1.0, 1.0);
        requireRange("offsetY", offsetY, -1.0, 1.0);
        requireRange("opacity", opacity, 0.0, 1.0);
        if (color == null) {
            throw new SpecValidationException("color is required");
        }
        if (aspectRatio == null) {
            throw new SpecValidationException("aspectRatio is required");
        }
    }

    /** Centered anvil at 70% scale and 50% opacity, the tool's defaults. */
    public static AnvilSpec defaults(RgbColor color, AspectRatio aspectRatio) {
        return new AnvilSpec(0.7, 0.0, 0.0, color, 0.5, aspectRatio);
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (!Double.isFinite(value) || value < min || value > max) {
            throw new SpecValidationException(name + " must be within [" + min + ", " + max + "], got " + value);
        }
    }
}
