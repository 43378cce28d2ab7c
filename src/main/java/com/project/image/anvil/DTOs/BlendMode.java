package com.project.image.anvil.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How a layer combines with the stack below it. */
public enum BlendMode {
    /** Source-over. */
    NORMAL,
    /** Destination-in: only the layer's alpha is used, as a clipping mask. */
    MASK;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
