package com.project.image.anvil.service.segmentation;

import com.project.image.anvil.exceptions.ExtractionFailureException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Salient-object network (U²-Net family) exported to ONNX, run through OpenCV DNN.
 * The network outputs one saliency map at {@code inputSize x inputSize}; it is
 * min-max normalized and resized back to the image.
 */
public class OnnxSegmentationModel implements SegmentationModel {
    private static final Logger log = LoggerFactory.getLogger(OnnxSegmentationModel.class);

    // ImageNet statistics the U²-Net weights were trained with
    private static final Scalar MEAN_RGB = new Scalar(0.485 * 255, 0.456 * 255, 0.406 * 255);
    private static final double STD = 0.226;

    private final Path modelPath;
    private final int inputSize;
    private volatile Net net;

    public OnnxSegmentationModel(Path modelPath, int inputSize) {
        this.modelPath = modelPath;
        this.inputSize = inputSize;
    }

    @Override
    public String name() {
        return "onnx:" + modelPath.getFileName();
    }

    @Override
    public void load() {
        if (!Files.isRegularFile(modelPath)) {
            throw new ExtractionFailureException("Model file not found: " + modelPath.toAbsolutePath());
        }
        OpenCvSupport.ensureLoaded();
        Net loadedNet = Dnn.readNetFromONNX(modelPath.toString());
        if (loadedNet.empty()) {
            throw new ExtractionFailureException("OpenCV could not read " + modelPath);
        }
        net = loadedNet;
    }

    @Override
    public byte[] predict(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        log.debug("ONNX inference on {}x{} at {}px", w, h, inputSize);
        Mat bgr = OpenCvSupport.toBgrMat(image);
        Mat blob = null, output = null, saliency = null, alpha = null, resized = null;
        try {
            blob = Dnn.blobFromImage(bgr, 1.0 / (255 * STD), new Size(inputSize, inputSize), MEAN_RGB, true, false);
            net.setInput(blob);
            output = net.forward();

            float[] values = new float[inputSize * inputSize];
            output.get(new int[]{0, 0, 0, 0}, values);
            saliency = new Mat(inputSize, inputSize, CvType.CV_32F);
            saliency.put(0, 0, values);

            alpha = new Mat();
            Core.normalize(saliency, saliency, 0, 255, Core.NORM_MINMAX);
            saliency.convertTo(alpha, CvType.CV_8U);

            resized = new Mat();
            Imgproc.resize(alpha, resized, new Size(w, h), 0, 0, Imgproc.INTER_LINEAR);
            return OpenCvSupport.toAlpha(resized);
        } finally {
            OpenCvSupport.release(bgr, blob, output, saliency, alpha, resized);
        }
    }
}
