package org.example.studio.entity;

/**
 * Read-side view of a generated artifact slot.
 */
public interface ArtifactState {

    /**
     * True when the slot belongs in a retry/dispatch work set.
     */
    default boolean needsGeneration() {
        return this instanceof NotStarted || this instanceof Failed;
    }

    record NotStarted() implements ArtifactState {}

    record Generating() implements ArtifactState {}

    record Ready(String ref) implements ArtifactState {}

    record Failed(String reason) implements ArtifactState {}
}
