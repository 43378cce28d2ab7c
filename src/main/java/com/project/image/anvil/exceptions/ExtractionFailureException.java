package com.project.image.anvil.exceptions;

/**
 * A segmentation model could not load or infer. Never reaches a job: the subject
 * extractor absorbs it and falls back.
 */
public class ExtractionFailureException extends AnvilException {
    public ExtractionFailureException(String message) { super(message); }
    public ExtractionFailureException(String message, Throwable cause) { super(message, cause); }
}
