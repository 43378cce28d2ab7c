package com.project.image.anvil.DTOs;

public enum CancelOutcome {
    /** Job was still queued and has been dropped. */
    REMOVED,
    /** Job is running; its result will be discarded when it finishes. */
    DISCARD_PENDING,
    ALREADY_FINISHED,
    NOT_FOUND
}
