package com.project.image.anvil.service;

import com.project.image.anvil.DTOs.ModelUsed;
import com.project.image.anvil.DTOs.SubjectMask;
import com.project.image.anvil.exceptions.ExtractionFailureException;
import com.project.image.anvil.service.segmentation.LazySegmentationModel;
import com.project.image.anvil.service.segmentation.SegmentationModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Isolates the photographic subject. Tries the primary model, then the fallback; if
 * both fail the whole frame is returned as subject with {@link ModelUsed#DEGRADED}.
 * Never throws for a decodable image.
 */
public class SubjectExtractor {
    private static final Logger log = LoggerFactory.getLogger(SubjectExtractor.class);

    private final SegmentationModels models;
    private final Duration inferenceTimeout;

    public SubjectExtractor(SegmentationModels models, Duration inferenceTimeout) {
        this.models = models;
        this.inferenceTimeout = inferenceTimeout;
    }

    public SubjectMask extractSubject(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        long start = System.nanoTime();
        try {
            SubjectMask mask = attempt(models.primary(), ModelUsed.PRIMARY, image);
            log.info("Subject extracted with primary model '{}' in {} ms", models.primary().name(), elapsedMs(start));
            return mask;
        } catch (ExtractionFailureException e) {
            log.warn("Primary segmentation failed, trying fallback: {}", e.getMessage());
        }
        try {
            SubjectMask mask = attempt(models.fallback(), ModelUsed.FALLBACK, image);
            log.info("Subject extracted with fallback model '{}' in {} ms", models.fallback().name(), elapsedMs(start));
            return mask;
        } catch (ExtractionFailureException e) {
            log.warn("Fallback segmentation failed, using the full frame as subject: {}", e.getMessage());
        }
        return SubjectMask.fullyOpaque(w, h);
    }

    private SubjectMask attempt(LazySegmentationModel model, ModelUsed stage, BufferedImage image) {
        Future<byte[]> future;
        try {
            future = models.submit(model, image);
        } catch (RejectedExecutionException e) {
            throw new ExtractionFailureException("'" + model.name() + "' is busy with earlier requests", e);
        }
        byte[] alpha;
        try {
            alpha = future.get(inferenceTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            models.abandon(model, future);
            throw new ExtractionFailureException("'" + model.name() + "' timed out after " + inferenceTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new ExtractionFailureException("'" + model.name() + "' failed: " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new ExtractionFailureException("'" + model.name() + "' was cancelled");
        } catch (InterruptedException e) {
            models.abandon(model, future);
            Thread.currentThread().interrupt();
            throw new ExtractionFailureException("Interrupted while waiting for '" + model.name() + "'");
        }
        if (alpha == null || alpha.length != image.getWidth() * image.getHeight()) {
            throw new ExtractionFailureException("'" + model.name() + "' returned a mask of the wrong size");
        }
        return new SubjectMask(image.getWidth(), image.getHeight(), alpha, stage);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
