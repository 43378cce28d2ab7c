package com.project.image.anvil.exceptions;

/** Unknown job id, or a job already collected, cancelled or expired. */
public class JobNotFoundException extends AnvilException {
    public JobNotFoundException(String jobId) { super("Job not found: " + jobId); }
}
