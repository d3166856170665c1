package org.example.studio.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Project-level workflow status. The lowercase spellings are persisted and read by
 * external callers, so existing values must never be renamed or repurposed.
 */
public enum ProjectStatus {
    DRAFT("draft"),
    AWAITING_CUSTOMER_INPUT("awaiting_customer_input"),

    // Character phase
    CHARACTER_REVIEW("character_review"),
    CHARACTER_GENERATION("character_generation"),
    CHARACTER_GENERATION_COMPLETE("character_generation_complete"),
    CHARACTER_GENERATION_FAILED("character_generation_failed"),
    CHARACTER_REVISION_NEEDED("character_revision_needed"),
    CHARACTERS_APPROVED("characters_approved"),
    CHARACTERS_REGENERATED("characters_regenerated"),

    // Illustration phase
    SKETCHES_REVIEW("sketches_review"),
    SKETCHES_REVISION("sketches_revision"),
    ILLUSTRATION_APPROVED("illustration_approved"),

    COMPLETED("completed");

    // Spellings written by older releases, read as their current-phase equivalent
    private static final Map<String, ProjectStatus> LEGACY_ALIASES = Map.of(
            "trial_review", SKETCHES_REVIEW,
            "illustration_review", SKETCHES_REVIEW,
            "trial_revision", SKETCHES_REVISION,
            "illustration_revision_needed", SKETCHES_REVISION,
            "trial_approved", ILLUSTRATION_APPROVED,
            "illustrations_generating", CHARACTERS_APPROVED
    );

    private final String value;

    ProjectStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolve a persisted or caller-supplied spelling to its canonical status.
     *
     * @throws IllegalArgumentException if the value is neither canonical nor a known alias
     */
    @JsonCreator
    public static ProjectStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Project status is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProjectStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        ProjectStatus alias = LEGACY_ALIASES.get(normalized);
        if (alias != null) {
            return alias;
        }
        throw new IllegalArgumentException("Unknown project status: " + value);
    }

    public static boolean isLegacyAlias(String value) {
        return value != null && LEGACY_ALIASES.containsKey(value.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isCharacterPhase() {
        return switch (this) {
            case DRAFT, AWAITING_CUSTOMER_INPUT, CHARACTER_REVIEW, CHARACTER_GENERATION,
                    CHARACTER_GENERATION_COMPLETE, CHARACTER_GENERATION_FAILED,
                    CHARACTER_REVISION_NEEDED, CHARACTERS_REGENERATED -> true;
            default -> false;
        };
    }

    public boolean isIllustrationPhase() {
        return switch (this) {
            case CHARACTERS_APPROVED, SKETCHES_REVIEW, SKETCHES_REVISION, ILLUSTRATION_APPROVED -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
