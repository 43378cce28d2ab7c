package com.project.image.anvil.exceptions;

/** Image is too large to process even after auto-downscale. */
public class ResourceExhaustionException extends AnvilException {
    public ResourceExhaustionException(String message) { super(message); }
}
