package com.project.image.anvil.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;
import com.project.image.anvil.exceptions.SpecValidationException;

import java.awt.Rectangle;

public enum AspectRatio {
    LANDSCAPE_16_9("16:9", 16, 9),
    SQUARE_1_1("1:1", 1, 1),
    PORTRAIT_9_16("9:16", 9, 16);

    // Images within 1% of the ratio are treated as already cropped.
    private static final double TOLERANCE = 0.01;

    private final String label;
    private final int widthUnits;
    private final int heightUnits;

    AspectRatio(String label, int widthUnits, int heightUnits) {
        this.label = label;
        this.widthUnits = widthUnits;
        this.heightUnits = heightUnits;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public double value() {
        return (double) widthUnits / heightUnits;
    }

    public static AspectRatio fromLabel(String label) {
        for (AspectRatio ratio : values()) {
            if (ratio.label.equals(label)) {
                return ratio;
            }
        }
        throw new SpecValidationException("Unsupported aspect ratio: " + label + " (expected 16:9, 1:1 or 9:16)");
    }

    /**
     * Largest centered rectangle of this ratio inside a {@code width x height} image.
     * Returns the full frame when the image already matches.
     */
    public Rectangle centerCrop(int width, int height) {
        double current = (double) width / height;
        if (Math.abs(current - value()) / value() <= TOLERANCE) {
            return new Rectangle(0, 0, width, height);
        }
        if (current > value()) {
            int cropWidth = Math.max(1, (int) Math.round(height * value()));
            return new Rectangle((width - cropWidth) / 2, 0, cropWidth, height);
        }
        int cropHeight = Math.max(1, (int) Math.round(width / value()));
        return new Rectangle(0, (height - cropHeight) / 2, width, cropHeight);
    }

    @Override
    public String toString() {
        return label;
    }
}
