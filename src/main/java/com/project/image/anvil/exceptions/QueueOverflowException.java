package com.project.image.anvil.exceptions;

/** The scheduler queue is full; the caller should retry later. */
public class QueueOverflowException extends AnvilException {
    private final int maxQueueDepth;

    public QueueOverflowException(int maxQueueDepth) {
        super("Processing queue is full (" + maxQueueDepth + " jobs waiting). Please retry later.");
        this.maxQueueDepth = maxQueueDepth;
    }

    public int getMaxQueueDepth() {
        return maxQueueDepth;
    }
}
