package org.example.studio.model;

import org.example.studio.entity.ProjectStatus;

import java.time.LocalDateTime;

public record GenerationJobStatusResponse(
        String projectId,
        ProjectStatus projectStatus,
        boolean batchInFlight,
        LocalDateTime asOf,
        GenerationPipelineStatus characters,
        GenerationPipelineStatus pages,
        GenerationPipelineStatus totals
) {
}
