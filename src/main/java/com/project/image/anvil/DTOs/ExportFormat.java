package com.project.image.anvil.DTOs;

import com.project.image.anvil.exceptions.SpecValidationException;

import java.util.Locale;

public enum ExportFormat {
    /** Single flattened PNG. */
    IMAGE,
    /** ZIP of editable layers plus metadata. */
    LAYERS;

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return IMAGE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "image", "png" -> IMAGE;
            case "layers", "zip" -> LAYERS;
            default -> throw new SpecValidationException("Unknown export format: " + value);
        };
    }
}
