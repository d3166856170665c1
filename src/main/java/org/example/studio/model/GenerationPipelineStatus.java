package org.example.studio.model;

public record GenerationPipelineStatus(
        long notStarted,
        long generating,
        long ready,
        long failed
) {
    public static GenerationPipelineStatus of(
            long notStarted,
            long generating,
            long ready,
            long failed) {
        return new GenerationPipelineStatus(
                Math.max(0L, notStarted),
                Math.max(0L, generating),
                Math.max(0L, ready),
                Math.max(0L, failed)
        );
    }

    public long total() {
        return notStarted + generating + ready + failed;
    }

    /**
     * Items a retry would dispatch.
     */
    public long pending() {
        return notStarted + failed;
    }
}
