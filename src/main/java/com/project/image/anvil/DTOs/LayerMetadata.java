package com.project.image.anvil.DTOs;

import java.util.List;

/**
 * Descriptive record written as {@code layer_info.json} next to the layers.
 */
public record LayerMetadata(
        String version,
        Style style,
        String colorName,
        String colorHex,
        double opacity,
        double scale,
        double offsetX,
        double offsetY,
        AspectRatio aspectRatio,
        int width,
        int height,
        ModelUsed subjectModel,
        String createdAt,
        List<Entry> layers,
        String compositeFile
) {
    public LayerMetadata {
        layers = List.copyOf(layers);
    }

    public String resolution() {
        return width + "x" + height;
    }

    public record Entry(String name, String file, BlendMode blendMode, String description) {
    }
}
