package com.project.image.anvil.DTOs;

public enum JobStatus {
    QUEUED,
    RUNNING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
