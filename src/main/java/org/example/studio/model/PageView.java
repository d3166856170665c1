package org.example.studio.model;

import org.example.studio.entity.PageEntity;

public record PageView(
        String id,
        int pageNumber,
        String storyText,
        String sceneDescription,
        ArtifactView illustration,
        ArtifactView sketch,
        String originalIllustrationUrl,
        FeedbackView feedback
) {
    public static PageView from(PageEntity page) {
        return new PageView(
                page.getId(),
                page.getPageNumber(),
                page.getStoryText(),
                page.getSceneDescription(),
                ArtifactView.from(page.getIllustration()),
                ArtifactView.from(page.getSketch()),
                page.getOriginalIllustrationUrl(),
                FeedbackView.from(page.getFeedback())
        );
    }
}
