package com.project.image.anvil.service;

import com.project.image.anvil.exceptions.AnvilException;
import com.project.image.anvil.exceptions.CompositeFailureException;
import com.project.image.anvil.exceptions.ProcessingTimeoutException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one pipeline step under a soft time limit. The calling worker waits for the step,
 * so steps still execute one at a time; on timeout the step thread is interrupted and
 * the pixel loops abort at the next row.
 */
public class StepRunner implements AutoCloseable {

    private final ExecutorService executor;

    public StepRunner() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("anvil.step-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> T run(String step, Duration limit, Supplier<T> work) {
        Future<T> future = executor.submit(work::get);
        try {
            return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProcessingTimeoutException(step, limit);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompositeFailureException(step + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnvilException anvil) {
                throw anvil;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompositeFailureException(step + " failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
