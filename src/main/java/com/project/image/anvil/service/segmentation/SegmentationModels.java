package com.project.image.anvil.service.segmentation;

import java.awt.image.BufferedImage;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide segmentation models: a primary and a fallback, each behind a load-once
 * barrier and each with a single inference thread. Created once and injected.
 *
 * <p>A model's backlog is bounded; when its thread is stuck in an inference that ignores
 * interruption, further requests are refused instead of piling up threads and images.
 */
public class SegmentationModels implements AutoCloseable {
    public static final int DEFAULT_BACKLOG = 4;

    private final LazySegmentationModel primary;
    private final LazySegmentationModel fallback;
    private final ThreadPoolExecutor primaryExecutor;
    private final ThreadPoolExecutor fallbackExecutor;

    public SegmentationModels(SegmentationModel primary, SegmentationModel fallback) {
        this(primary, fallback, DEFAULT_BACKLOG);
    }

    public SegmentationModels(SegmentationModel primary, SegmentationModel fallback, int backlog) {
        if (backlog < 1) {
            throw new IllegalArgumentException("Inference backlog must be at least 1, got " + backlog);
        }
        this.primary = new LazySegmentationModel(primary);
        this.fallback = new LazySegmentationModel(fallback);
        this.primaryExecutor = singleThread(this.primary.name(), backlog);
        this.fallbackExecutor = singleThread(this.fallback.name(), backlog);
    }

    private static ThreadPoolExecutor singleThread(String modelName, int backlog) {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(backlog), r -> {
            Thread t = new Thread(r);
            t.setName("anvil.inference-" + modelName);
            t.setDaemon(true);
            return t;
        }, new ThreadPoolExecutor.AbortPolicy());
    }

    public LazySegmentationModel primary() {
        return primary;
    }

    public LazySegmentationModel fallback() {
        return fallback;
    }

    /**
     * Queues an inference on the model's own thread.
     *
     * @throws RejectedExecutionException when the model's backlog is full
     */
    public Future<byte[]> submit(LazySegmentationModel model, BufferedImage image) {
        return executorFor(model).submit(() -> model.predict(image));
    }

    /** Cancels an inference and drops it from the backlog so its image can be collected. */
    public void abandon(LazySegmentationModel model, Future<?> inference) {
        inference.cancel(true);
        executorFor(model).purge();
    }

    private ThreadPoolExecutor executorFor(LazySegmentationModel model) {
        if (model == primary) {
            return primaryExecutor;
        }
        if (model == fallback) {
            return fallbackExecutor;
        }
        throw new IllegalArgumentException("Unknown model '" + model.name() + "'");
    }

    @Override
    public void close() {
        primaryExecutor.shutdownNow();
        fallbackExecutor.shutdownNow();
    }
}
