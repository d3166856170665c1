package org.example.studio.generation;

import org.example.studio.entity.CharacterEntity;
import org.example.studio.entity.PageEntity;
import org.example.studio.entity.ProjectEntity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationPromptBuilderTest {

    private final GenerationPromptBuilder builder = new GenerationPromptBuilder("watercolor");
    private final ProjectEntity project = new ProjectEntity("Fox and Owl");

    @Test
    void characterPortraitIncludesDescriptionAndStyle() {
        CharacterEntity owl = new CharacterEntity(project, "Owl", false);
        owl.setHairColor("grey");
        owl.setClothing(" a blue scarf ");

        String prompt = builder.characterPortrait(owl);

        assertTrue(prompt.startsWith("full body character portrait of Owl"));
        assertTrue(prompt.contains("hair color: grey"));
        assertTrue(prompt.contains("wearing a blue scarf"));
        assertTrue(prompt.endsWith("plain white background, watercolor"));
        assertFalse(prompt.contains("revision request"));
    }

    @Test
    void openFeedbackIsAppendedToPortrait() {
        CharacterEntity owl = new CharacterEntity(project, "Owl", false);
        owl.getFeedback().setFeedbackNotes("make the eyes bigger");

        assertTrue(builder.characterPortrait(owl).contains("revision request: make the eyes bigger"));

        owl.getFeedback().setResolved(true);
        assertFalse(builder.characterPortrait(owl).contains("revision request"));
    }

    @Test
    void pageIllustrationPrefersSceneDescription() {
        PageEntity page = new PageEntity(project, 3, "The fox ran home.");
        assertEquals("The fox ran home., watercolor", builder.pageIllustration(page));

        page.setSceneDescription("fox running through a meadow at dusk");
        page.getFeedback().setFeedbackNotes("add the moon");
        assertEquals("fox running through a meadow at dusk, revision request: add the moon, watercolor",
                builder.pageIllustration(page));
    }

    @Test
    void pageWithoutTextFallsBackToPageNumber() {
        PageEntity page = new PageEntity(project, 7, null);

        assertEquals("illustration for page 7, watercolor", builder.pageIllustration(page));
        assertEquals("pencil sketch of the scene on page 7, same composition", builder.pageSketch(page));
    }
}
