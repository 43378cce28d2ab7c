package com.project.image.anvil.service.segmentation;

import com.project.image.anvil.exceptions.ExtractionFailureException;
import com.project.image.anvil.service.ImageCodec;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Classic GrabCut seeded with an inset rectangle. Needs no weights, so it serves as the
 * fallback when the network is unavailable. Runs on a bounded working copy.
 */
public class GrabCutSegmentationModel implements SegmentationModel {
    private static final Logger log = LoggerFactory.getLogger(GrabCutSegmentationModel.class);

    private final int iterations;
    private final int workingEdge;

    public GrabCutSegmentationModel(int iterations, int workingEdge) {
        this.iterations = iterations;
        this.workingEdge = workingEdge;
    }

    @Override
    public String name() {
        return "grabcut";
    }

    @Override
    public void load() {
        OpenCvSupport.ensureLoaded();
    }

    @Override
    public byte[] predict(BufferedImage input) {
        BufferedImage work = ImageCodec.fitWithin(input, workingEdge);
        int w = work.getWidth(), h = work.getHeight();
        log.debug("GrabCut on {}x{} (source {}x{})", w, h, input.getWidth(), input.getHeight());

        Mat image = OpenCvSupport.toBgrMat(work);
        Mat mask = new Mat();
        Mat bgdModel = new Mat();
        Mat fgdModel = new Mat();
        Mat sure = new Mat();
        Mat probable = new Mat();
        Mat foreground = new Mat();
        Mat resized = new Mat();
        try {
            int border = Math.max(1, Math.min(w, h) / 10);
            if (w <= 2 * border || h <= 2 * border) {
                throw new ExtractionFailureException("Image too small for GrabCut: " + w + "x" + h);
            }
            Rect rectangle = new Rect(border, border, w - 2 * border, h - 2 * border);
            Imgproc.grabCut(image, mask, rectangle, bgdModel, fgdModel, iterations, Imgproc.GC_INIT_WITH_RECT);

            Core.compare(mask, new Scalar(Imgproc.GC_FGD), sure, Core.CMP_EQ);
            Core.compare(mask, new Scalar(Imgproc.GC_PR_FGD), probable, Core.CMP_EQ);
            Core.bitwise_or(sure, probable, foreground);
            if (Core.countNonZero(foreground) == 0) {
                throw new ExtractionFailureException("GrabCut found no foreground");
            }

            Imgproc.resize(foreground, resized, new Size(input.getWidth(), input.getHeight()), 0, 0, Imgproc.INTER_LINEAR);
            return OpenCvSupport.toAlpha(resized);
        } finally {
            OpenCvSupport.release(image, mask, bgdModel, fgdModel, sure, probable, foreground, resized);
        }
    }
}
