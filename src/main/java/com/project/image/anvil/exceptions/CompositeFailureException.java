package com.project.image.anvil.exceptions;

public class CompositeFailureException extends AnvilException {
    public CompositeFailureException(String message) { super(message); }
    public CompositeFailureException(String message, Throwable cause) { super(message, cause); }
}
