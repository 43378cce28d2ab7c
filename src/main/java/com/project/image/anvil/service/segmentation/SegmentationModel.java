package com.project.image.anvil.service.segmentation;

import java.awt.image.BufferedImage;

/**
 * A subject segmentation backend. Implementations report failures with
 * {@link com.project.image.anvil.exceptions.ExtractionFailureException}.
 */
public interface SegmentationModel {

    String name();

    /** Loads weights or native code. Called at most once per process. */
    void load();

    /**
     * @return subject alpha, 0..255, one byte per pixel, row-major, same size as {@code image}
     */
    byte[] predict(BufferedImage image);
}
