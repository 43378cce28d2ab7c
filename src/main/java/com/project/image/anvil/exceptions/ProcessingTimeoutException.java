package com.project.image.anvil.exceptions;

import java.time.Duration;

public class ProcessingTimeoutException extends AnvilException {
    public ProcessingTimeoutException(String step, Duration limit) {
        super(step + " timed out after " + limit.toMillis() + " ms");
    }
}
