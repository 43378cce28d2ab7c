package com.project.image.anvil.service.segmentation;

import com.project.image.anvil.exceptions.ExtractionFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Load-once wrapper. Concurrent first use triggers a single {@link SegmentationModel#load()};
 * a failed load is remembered for the life of the process. Inference is serialized because
 * the underlying networks are not thread-safe.
 */
public class LazySegmentationModel implements SegmentationModel {
    private static final Logger log = LoggerFactory.getLogger(LazySegmentationModel.class);

    private enum State { NOT_LOADED, READY, FAILED }

    private final SegmentationModel delegate;
    private final ReentrantLock inferenceLock = new ReentrantLock();
    private volatile State state = State.NOT_LOADED;
    private volatile String failure;

    public LazySegmentationModel(SegmentationModel delegate) {
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public void load() {
        if (state == State.READY) {
            return;
        }
        synchronized (this) {
            if (state == State.NOT_LOADED) {
                long start = System.nanoTime();
                try {
                    delegate.load();
                    state = State.READY;
                    log.info("Segmentation model '{}' loaded in {} ms", name(), (System.nanoTime() - start) / 1_000_000);
                } catch (RuntimeException | LinkageError e) {
                    failure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                    state = State.FAILED;
                    log.warn("Segmentation model '{}' failed to load: {}", name(), failure);
                }
            }
            if (state == State.FAILED) {
                throw new ExtractionFailureException("Model '" + name() + "' unavailable: " + failure);
            }
        }
    }

    @Override
    public byte[] predict(BufferedImage image) {
        load();
        try {
            inferenceLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionFailureException("Interrupted while waiting for model '" + name() + "'");
        }
        try {
            return delegate.predict(image);
        } catch (ExtractionFailureException e) {
            throw e;
        } catch (RuntimeException | LinkageError e) {
            throw new ExtractionFailureException("Model '" + name() + "' failed: " + e.getMessage(), e);
        } finally {
            inferenceLock.unlock();
        }
    }

    public boolean isReady() {
        return state == State.READY;
    }
}
