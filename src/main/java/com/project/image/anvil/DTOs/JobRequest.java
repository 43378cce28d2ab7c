package com.project.image.anvil.DTOs;

import com.project.image.anvil.exceptions.SpecValidationException;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

/**
 * Everything a worker needs to run one job. Build through {@link #preview} or
 * {@link #advanced}; they enforce the style count per kind.
 *
 * @param baseName stem of the uploaded file name, used for download names
 */
public record JobRequest(
        JobKind kind,
        BufferedImage image,
        AnvilSpec spec,
        List<Style> styles,
        ExportFormat exportFormat,
        String baseName
) {
    public JobRequest {
        if (image == null) {
            throw new SpecValidationException("No image data provided");
        }
        if (spec == null) {
            throw new SpecValidationException("Anvil spec is required");
        }
        styles = List.copyOf(styles);
        if (kind == JobKind.PREVIEW && (!coversEveryStyleOnce(styles) || exportFormat != ExportFormat.IMAGE)) {
            throw new SpecValidationException("Preview jobs render all six styles as images");
        }
        if (kind == JobKind.ADVANCED && styles.size() != 1) {
            throw new SpecValidationException("Advanced jobs render exactly one style");
        }
        baseName = (baseName == null || baseName.isBlank()) ? "image" : baseName;
    }

    public static JobRequest preview(BufferedImage image, AnvilSpec spec, String baseName) {
        return new JobRequest(JobKind.PREVIEW, image, spec, Arrays.asList(Style.values()), ExportFormat.IMAGE, baseName);
    }

    public static JobRequest advanced(BufferedImage image, AnvilSpec spec, Style style, ExportFormat format, String baseName) {
        if (style == null) {
            throw new SpecValidationException("Advanced jobs need a style");
        }
        return new JobRequest(JobKind.ADVANCED, image, spec, List.of(style), format == null ? ExportFormat.IMAGE : format, baseName);
    }

    private static boolean coversEveryStyleOnce(List<Style> styles) {
        return styles.size() == Style.values().length && EnumSet.copyOf(styles).size() == styles.size();
    }

    /** The single style of an advanced job. */
    public Style style() {
        return styles.get(0);
    }

    public boolean wantsLayers() {
        return exportFormat == ExportFormat.LAYERS;
    }
}
