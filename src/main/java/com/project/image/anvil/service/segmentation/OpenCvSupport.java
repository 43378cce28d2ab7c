package com.project.image.anvil.service.segmentation;

import com.project.image.anvil.exceptions.ExtractionFailureException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/** Native library loading and raster conversion shared by the OpenCV models. */
final class OpenCvSupport {
    private static final Logger log = LoggerFactory.getLogger(OpenCvSupport.class);

    private static volatile boolean loaded;

    private OpenCvSupport() {
    }

    static synchronized void ensureLoaded() {
        if (loaded) {
            return;
        }
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV loaded successfully");
        } catch (RuntimeException | LinkageError e) {
            throw new ExtractionFailureException("Failed to load OpenCV: " + e.getMessage(), e);
        }
    }

    static Mat toBgrMat(BufferedImage image) {
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    /** Copies a single-channel 8-bit mat into a row-major byte array. */
    static byte[] toAlpha(Mat mask) {
        byte[] data = new byte[mask.rows() * mask.cols()];
        mask.get(0, 0, data);
        return data;
    }

    static void release(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null) {
                mat.release();
            }
        }
    }
}
