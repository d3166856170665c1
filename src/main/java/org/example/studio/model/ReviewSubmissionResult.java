package org.example.studio.model;

import org.example.studio.entity.ProjectStatus;

public record ReviewSubmissionResult(
        String projectId,
        ProjectStatus status,
        boolean generationStarted,
        String message
) {
}
