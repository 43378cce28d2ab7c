package com.project.image.anvil.exceptions;

/** Root of the domain-specific processing errors. */
public class AnvilException extends RuntimeException {
    public AnvilException(String message) { super(message); }
    public AnvilException(String message, Throwable cause) { super(message, cause); }
}
