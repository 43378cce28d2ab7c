package com.project.image.anvil.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * JSON body of a status poll. Image bytes are fetched through the download endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        String jobId,
        String kind,
        String status,
        Integer queuePosition,
        String error,
        List<String> styles,
        boolean layers,
        String modelUsed,
        Boolean autoDownscaled,
        Integer width,
        Integer height,
        Instant createdAt,
        Instant completedAt
) {
    public static JobStatusResponse from(JobSnapshot snapshot) {
        ProcessingResult result = snapshot.result();
        return new JobStatusResponse(
                snapshot.jobId(),
                snapshot.kind().name().toLowerCase(Locale.ROOT),
                snapshot.status().name().toLowerCase(Locale.ROOT),
                snapshot.queuePosition(),
                snapshot.errorDetail(),
                result == null ? null : result.styles().stream().map(r -> r.style().displayName()).toList(),
                result != null && result.layerPackage() != null,
                result == null || result.modelUsed() == null ? null : result.modelUsed().name().toLowerCase(Locale.ROOT),
                result == null ? null : result.autoDownscaled(),
                result == null ? null : result.width(),
                result == null ? null : result.height(),
                snapshot.createdAt(),
                snapshot.completedAt());
    }
}
