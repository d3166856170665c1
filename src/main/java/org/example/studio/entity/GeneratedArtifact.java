package org.example.studio.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.time.LocalDateTime;

/**
 * One generated image slot (portrait, sketch, illustration). Failure is an explicit status
 * with its reason, never a marker hidden in the URL.
 */
@Embeddable
public class GeneratedArtifact {

    static final String LEGACY_ERROR_PREFIX = "error:";

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private ArtifactStatus status = ArtifactStatus.NOT_STARTED;

    @Column(length = 1000)
    private String url;

    @Column(length = 1000)
    private String errorMessage;

    private LocalDateTime updatedAt;

    public GeneratedArtifact() {}

    /**
     * Map a URL column written by the old sentinel scheme ({@code error:<reason>}) onto a slot.
     */
    public static GeneratedArtifact fromLegacyUrl(String legacyUrl) {
        GeneratedArtifact artifact = new GeneratedArtifact();
        if (legacyUrl == null || legacyUrl.isBlank()) {
            return artifact;
        }
        if (legacyUrl.startsWith(LEGACY_ERROR_PREFIX)) {
            artifact.markFailed(legacyUrl.substring(LEGACY_ERROR_PREFIX.length()).trim());
        } else {
            artifact.markReady(legacyUrl.trim());
        }
        return artifact;
    }

    /**
     * Rows written before slots carried a status keep their outcome in the URL column alone.
     * Such a slot is re-read through {@link #fromLegacyUrl}; any other slot is returned as is.
     */
    public static GeneratedArtifact upgradeLegacy(GeneratedArtifact slot) {
        if (slot == null) {
            return new GeneratedArtifact();
        }
        if (slot.status != null || slot.url == null || slot.url.isBlank()) {
            return slot;
        }
        GeneratedArtifact upgraded = fromLegacyUrl(slot.url);
        if (slot.updatedAt != null) {
            upgraded.updatedAt = slot.updatedAt;
        }
        return upgraded;
    }

    public ArtifactState state() {
        ArtifactStatus current = status == null ? ArtifactStatus.NOT_STARTED : status;
        return switch (current) {
            case NOT_STARTED -> new ArtifactState.NotStarted();
            case GENERATING -> new ArtifactState.Generating();
            case READY -> new ArtifactState.Ready(url);
            case FAILED -> new ArtifactState.Failed(errorMessage);
        };
    }

    public boolean needsGeneration() {
        return state().needsGeneration();
    }

    public boolean isReady() {
        return status == ArtifactStatus.READY && url != null && !url.isBlank();
    }

    public void markGenerating() {
        this.status = ArtifactStatus.GENERATING;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * A successful generation replaces both the reference and any earlier failure.
     */
    public void markReady(String ref) {
        this.status = ArtifactStatus.READY;
        this.url = ref;
        this.errorMessage = null;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * The previous reference is dropped so a failed slot is never shown as current.
     */
    public void markFailed(String reason) {
        this.status = ArtifactStatus.FAILED;
        this.url = null;
        this.errorMessage = (reason == null || reason.isBlank()) ? "Generation failed" : reason;
        this.updatedAt = LocalDateTime.now();
    }

    public ArtifactStatus getStatus() { return status == null ? ArtifactStatus.NOT_STARTED : status; }

    public String getUrl() { return url; }

    public String getErrorMessage() { return errorMessage; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
