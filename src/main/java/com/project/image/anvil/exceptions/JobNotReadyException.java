package com.project.image.anvil.exceptions;

/** A download was requested for a job that has no result to hand out. */
public class JobNotReadyException extends AnvilException {
    public JobNotReadyException(String message) { super(message); }
}
