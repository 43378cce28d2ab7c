package com.project.image.anvil.DTOs;

/** Which segmentation stage produced a subject mask. */
public enum ModelUsed {
    PRIMARY,
    FALLBACK,
    /** Both models failed; the whole frame is treated as subject. */
    DEGRADED
}
