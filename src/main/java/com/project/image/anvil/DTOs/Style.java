package com.project.image.anvil.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;
import com.project.image.anvil.exceptions.SpecValidationException;

import java.util.Locale;

/** The six anvil styles, in preview generation order. */
public enum Style {
    FLAT("Flat", false),
    STROKE("Stroke", false),
    GRADIENT("Gradient", false),
    WINDOW("Window", false),
    SILHOUETTE("Silhouette", true),
    GRADIENT_SILHOUETTE("Gradient Silhouette", true);

    private final String displayName;
    private final boolean needsSubject;

    Style(String displayName, boolean needsSubject) {
        this.displayName = displayName;
        this.needsSubject = needsSubject;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public boolean needsSubject() {
        return needsSubject;
    }

    /** Lower-case, separator-free form used in file names, e.g. {@code gradientsilhouette}. */
    public String slug() {
        return displayName.replace(" ", "").toLowerCase(Locale.ROOT);
    }

    /** Accepts the display name, the enum constant or the slug, case-insensitively. */
    public static Style parse(String value) {
        if (value != null) {
            String v = value.trim();
            for (Style style : values()) {
                if (style.displayName.equalsIgnoreCase(v)
                        || style.name().equalsIgnoreCase(v)
                        || style.slug().equalsIgnoreCase(v.replace(" ", "").replace("_", ""))) {
                    return style;
                }
            }
        }
        throw new SpecValidationException("Unknown style: " + value);
    }
}
