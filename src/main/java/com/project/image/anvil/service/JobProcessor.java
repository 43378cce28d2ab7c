package com.project.image.anvil.service;

import com.project.image.anvil.DTOs.JobRequest;
import com.project.image.anvil.DTOs.ProcessingResult;

/**
 * Work executed by the scheduler's workers.
 */
public interface JobProcessor {

    /**
     * Checks a request before it is queued. Runs on the submitting thread and must be cheap.
     */
    default void admit(JobRequest request) {
    }

    ProcessingResult process(JobRequest request);
}
