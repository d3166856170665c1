package org.example.studio.entity;

public enum ArtifactStatus {
    NOT_STARTED,
    GENERATING,
    READY,
    FAILED
}
