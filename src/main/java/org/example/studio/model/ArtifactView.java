package org.example.studio.model;

import org.example.studio.entity.ArtifactStatus;
import org.example.studio.entity.GeneratedArtifact;

import java.time.LocalDateTime;

public record ArtifactView(ArtifactStatus status, String url, String errorMessage, LocalDateTime updatedAt) {

    public static ArtifactView from(GeneratedArtifact artifact) {
        return new ArtifactView(artifact.getStatus(), artifact.getUrl(), artifact.getErrorMessage(), artifact.getUpdatedAt());
    }
}
