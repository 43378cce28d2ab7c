package com.project.image.anvil.exceptions;

/** Malformed spec or input image. Raised before a job is queued. */
public class SpecValidationException extends AnvilException {
    public SpecValidationException(String message) { super(message); }
}
