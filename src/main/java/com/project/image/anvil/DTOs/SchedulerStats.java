package com.project.image.anvil.DTOs;

import java.time.Instant;
import java.util.List;

public record SchedulerStats(
        int workers,
        int maxQueueDepth,
        int queued,
        int running,
        int done,
        int failed,
        List<PendingJob> pendingJobs
) {
    public record PendingJob(String jobId, JobKind kind, JobStatus status, Instant createdAt) {
    }
}
