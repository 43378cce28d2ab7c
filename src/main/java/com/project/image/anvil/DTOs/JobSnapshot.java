package com.project.image.anvil.DTOs;

import java.time.Instant;

/**
 * Point-in-time view of a job for polling callers.
 *
 * @param queuePosition 1-based position, {@code null} unless {@link JobStatus#QUEUED}
 */
public record JobSnapshot(
        String jobId,
        JobKind kind,
        JobStatus status,
        Integer queuePosition,
        ProcessingResult result,
        String errorDetail,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
}
