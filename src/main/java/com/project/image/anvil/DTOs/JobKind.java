package com.project.image.anvil.DTOs;

public enum JobKind {
    /** Low resolution, all six styles. */
    PREVIEW,
    /** Original resolution, one style, optional layer package. */
    ADVANCED
}
