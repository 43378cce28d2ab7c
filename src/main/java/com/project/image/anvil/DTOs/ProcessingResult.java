package com.project.image.anvil.DTOs;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one job. Either every requested style is present or the job failed.
 *
 * @param layerPackage   set only for advanced jobs that asked for layers
 * @param modelUsed      stage of the subject extraction, {@code null} when none ran
 * @param autoDownscaled true when an advanced input exceeded the maximum edge
 * @param baseName       upload file stem, for download names
 * @param colorSlug      palette name of the colour without spaces, or {@code Custom}
 */
public record ProcessingResult(
        JobKind kind,
        List<StyleResult> styles,
        LayerPackage layerPackage,
        ModelUsed modelUsed,
        boolean autoDownscaled,
        int width,
        int height,
        String baseName,
        String colorSlug
) {
    public ProcessingResult {
        styles = List.copyOf(styles);
    }

    public Optional<StyleResult> style(Style style) {
        return styles.stream().filter(r -> r.style() == style).findFirst();
    }

    /** Style display name to PNG bytes, in generation order. */
    public Map<String, byte[]> imagesByStyleName() {
        Map<String, byte[]> images = new LinkedHashMap<>();
        for (StyleResult r : styles) {
            images.put(r.style().displayName(), r.imageBytes());
        }
        return images;
    }

    /** e.g. {@code beach_gradientsilhouette_Blue2.png} */
    public String downloadName(Style style) {
        return baseName + "_" + style.slug() + "_" + colorSlug + ".png";
    }

    public String packageName(Style style) {
        return baseName + "_" + style.slug() + "_" + colorSlug + "_layers.zip";
    }
}
