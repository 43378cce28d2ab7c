package com.project.image.anvil.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration for the anvil tool, bound from {@code app.anvil.*}.
 */
@ConfigurationProperties(prefix = "app.anvil")
public class AnvilProperties {
    private final Shape shape = new Shape();
    private final Gradient gradient = new Gradient();
    private final StyleSettings style = new StyleSettings();
    private final Pipeline pipeline = new Pipeline();
    private final Segmentation segmentation = new Segmentation();
    private final Scheduler scheduler = new Scheduler();

    public Shape getShape() {
        return shape;
    }

    public Gradient getGradient() {
        return gradient;
    }

    public StyleSettings getStyle() {
        return style;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public Segmentation getSegmentation() {
        return segmentation;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Shape {
        // "x,y" pairs inside the normalized 2:1 box
        private List<String> vertices = new ArrayList<>(List.of("0,0", "1,0", "0.5,1", "0,1"));

        public List<String> getVertices() {
            return vertices;
        }

        public void setVertices(List<String> vertices) {
            this.vertices = vertices;
        }
    }

    public static class Gradient {
        // >0 mixes toward white, <0 toward black; first stop sits at the shape's left edge
        private List<Double> tones = new ArrayList<>(List.of(0.75, 0.5, 0.25, 0.0, -0.25));

        public List<Double> getTones() {
            return tones;
        }

        public void setTones(List<Double> tones) {
            this.tones = tones;
        }
    }

    public static class StyleSettings {
        private double strokeFraction = 0.02;

        public double getStrokeFraction() {
            return strokeFraction;
        }

        public void setStrokeFraction(double strokeFraction) {
            this.strokeFraction = strokeFraction;
        }
    }

    public static class Pipeline {
        private int previewMaxEdge = 1920;
        private int advancedMaxEdge = 7680;
        private long maxInputPixels = 50_000_000L;
        private int maxInputDimension = 8192;
        private int minEdge = 16;
        private Duration compositeTimeout = Duration.ofSeconds(60);

        public int getPreviewMaxEdge() {
            return previewMaxEdge;
        }

        public void setPreviewMaxEdge(int previewMaxEdge) {
            this.previewMaxEdge = previewMaxEdge;
        }

        public int getAdvancedMaxEdge() {
            return advancedMaxEdge;
        }

        public void setAdvancedMaxEdge(int advancedMaxEdge) {
            this.advancedMaxEdge = advancedMaxEdge;
        }

        public long getMaxInputPixels() {
            return maxInputPixels;
        }

        public void setMaxInputPixels(long maxInputPixels) {
            this.maxInputPixels = maxInputPixels;
        }

        public int getMaxInputDimension() {
            return maxInputDimension;
        }

        public void setMaxInputDimension(int maxInputDimension) {
            this.maxInputDimension = maxInputDimension;
        }

        public int getMinEdge() {
            return minEdge;
        }

        public void setMinEdge(int minEdge) {
            this.minEdge = minEdge;
        }

        public Duration getCompositeTimeout() {
            return compositeTimeout;
        }

        public void setCompositeTimeout(Duration compositeTimeout) {
            this.compositeTimeout = compositeTimeout;
        }
    }

    public static class Segmentation {
        private String primaryModelPath = "models/u2net_human_seg.onnx";
        private int primaryInputSize = 320;
        private int grabCutIterations = 5;
        private int grabCutWorkingEdge = 512;
        private Duration extractionTimeout = Duration.ofSeconds(45);

        public String getPrimaryModelPath() {
            return primaryModelPath;
        }

        public void setPrimaryModelPath(String primaryModelPath) {
            this.primaryModelPath = primaryModelPath;
        }

        public int getPrimaryInputSize() {
            return primaryInputSize;
        }

        public void setPrimaryInputSize(int primaryInputSize) {
            this.primaryInputSize = primaryInputSize;
        }

        public int getGrabCutIterations() {
            return grabCutIterations;
        }

        public void setGrabCutIterations(int grabCutIterations) {
            this.grabCutIterations = grabCutIterations;
        }

        public int getGrabCutWorkingEdge() {
            return grabCutWorkingEdge;
        }

        public void setGrabCutWorkingEdge(int grabCutWorkingEdge) {
            this.grabCutWorkingEdge = grabCutWorkingEdge;
        }

        public Duration getExtractionTimeout() {
            return extractionTimeout;
        }

        public void setExtractionTimeout(Duration extractionTimeout) {
            this.extractionTimeout = extractionTimeout;
        }
    }

    public static class Scheduler {
        private int poolSize = 1;
        private int maxQueueDepth = 20;
        private Duration resultTtl = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofMinutes(5);

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getMaxQueueDepth() {
            return maxQueueDepth;
        }

        public void setMaxQueueDepth(int maxQueueDepth) {
            this.maxQueueDepth = maxQueueDepth;
        }

        public Duration getResultTtl() {
            return resultTtl;
        }

        public void setResultTtl(Duration resultTtl) {
            this.resultTtl = resultTtl;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }
}
