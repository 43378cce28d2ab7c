package com.project.image.anvil.DTOs;

import java.util.Arrays;

/**
 * Per-pixel subject alpha (0..255, row-major) and the model stage that produced it.
 */
public record SubjectMask(int width, int height, byte[] alpha, ModelUsed modelUsed) {

    public SubjectMask {
        if (alpha.length != width * height) {
            throw new IllegalArgumentException("Mask has " + alpha.length + " values for " + width + "x" + height);
        }
    }

    /** Whole frame is subject. Used when extraction degrades. */
    public static SubjectMask fullyOpaque(int width, int height) {
        byte[] alpha = new byte[width * height];
        Arrays.fill(alpha, (byte) 0xFF);
        return new SubjectMask(width, height, alpha, ModelUsed.DEGRADED);
    }

    public int alphaAt(int index) {
        return alpha[index] & 0xFF;
    }

    public boolean isDegraded() {
        return modelUsed == ModelUsed.DEGRADED;
    }
}
