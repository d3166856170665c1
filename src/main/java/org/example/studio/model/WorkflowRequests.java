package org.example.studio.model;

import java.util.List;

/**
 * Request bodies accepted by the admin and review endpoints.
 */
public final class WorkflowRequests {

    private WorkflowRequests() {
    }

    public record CreateProject(
            String bookTitle,
            String authorFirstname,
            String authorLastname,
            String authorEmail,
            String authorPhone,
            CharacterDetails mainCharacter
    ) {
    }

    public record CharacterDetails(
            String name,
            String role,
            String storyRole,
            String age,
            String gender,
            String skinColor,
            String hairColor,
            String hairStyle,
            String eyeColor,
            String clothing,
            String accessories,
            String specialFeatures,
            String imageUrl
    ) {
    }

    public record PageDetails(int pageNumber, String storyText, String sceneDescription) {
    }

    public record Pages(List<PageDetails> pages) {
    }

    public record Generate(GenerationScope.Kind kind, String itemId) {
    }

    public record Resolve(ResolveMode mode) {
    }

    public enum ResolveMode {
        REGENERATION,
        MANUAL
    }

    public record Text(String text) {
    }

    public record ImageReference(String url) {
    }
}
