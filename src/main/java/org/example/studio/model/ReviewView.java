package org.example.studio.model;

import org.example.studio.entity.ProjectStatus;

import java.util.List;

/**
 * What the customer sees through the review link. Leaves out contact details and the token.
 */
public record ReviewView(
        String projectId,
        String bookTitle,
        ProjectStatus status,
        int characterRound,
        int illustrationRound,
        List<CharacterView> characters,
        List<PageView> pages
) {
    public static ReviewView from(ProjectView project) {
        return new ReviewView(
                project.id(),
                project.bookTitle(),
                project.status(),
                project.characterSendCount(),
                project.illustrationSendCount(),
                project.characters(),
                project.pages()
        );
    }
}
