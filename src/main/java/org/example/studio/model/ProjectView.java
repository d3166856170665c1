package org.example.studio.model;

import org.example.studio.entity.ProjectEntity;
import org.example.studio.entity.ProjectStatus;

import java.time.LocalDateTime;
import java.util.List;

public record ProjectView(
        String id,
        String bookTitle,
        String authorFirstname,
        String authorLastname,
        String authorEmail,
        String authorPhone,
        ProjectStatus status,
        String reviewToken,
        int characterSendCount,
        int illustrationSendCount,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        List<CharacterView> characters,
        List<PageView> pages
) {
    public static ProjectView summary(ProjectEntity project) {
        return of(project, List.of(), List.of());
    }

    public static ProjectView of(ProjectEntity project, List<CharacterView> characters, List<PageView> pages) {
        return new ProjectView(
                project.getId(),
                project.getBookTitle(),
                project.getAuthorFirstname(),
                project.getAuthorLastname(),
                project.getAuthorEmail(),
                project.getAuthorPhone(),
                project.getStatus(),
                project.getReviewToken(),
                project.getCharacterSendCount(),
                project.getIllustrationSendCount(),
                project.getCreatedAt(),
                project.getUpdatedAt(),
                characters,
                pages
        );
    }
}
